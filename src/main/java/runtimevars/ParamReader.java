package runtimevars;

import java.io.File;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;

public class ParamReader {

	private static final Logger LOGGER = Logger.getLogger(ParamReader.class.getName());

	public void setParameters(String paramFile) {

		// read JSON from file
		String json = "";
		try {
			json = FileUtils.readFileToString(new File(paramFile), "utf-8");
		} catch (IOException e) {
			LOGGER.log(Level.WARNING, "Error reading JSON parameters. Falling back to default parameter values.", e);
			return;
		}

		// set JSONObject
		JSONObject obj;
		try {
			obj = new JSONObject(json);
		} catch (JSONException e) {
			LOGGER.log(Level.WARNING, "Malformed JSON in '" + paramFile + "'. Falling back to default parameter values.",
					e);
			return;
		}

		this.setParameters(obj);
	}

	public void setParameters(JSONObject obj) {

		// set each parameter
		this.setBoolean(obj, "undistortedImages");

		this.setBoolean(obj, "autosave");
		this.setString(obj, "savePath");

		this.setInteger(obj, "undistortMaxIterations");
		this.setDouble(obj, "undistortTolerance");
		this.setDouble(obj, "skewTolerance");
		this.setDouble(obj, "rotationDeterminantTolerance");

		this.setDouble(obj, "degenerateEpsilon");
		this.setBoolean(obj, "parallelFrames");

		this.setInteger(obj, "statusRoundingDecimals");

		this.setString(obj, "logLevel");

	}

	public void setString(JSONObject obj, String var) {

		if (!obj.has(var)) {
			return;
		}
		try {
			String value = obj.getString(var);
			Parameters.<String>put(var, value);
		} catch (JSONException e) {
			LOGGER.warning("Error parsing '" + var + "'. Falling back to default value.");
		}

	}

	public void setDouble(JSONObject obj, String var) {

		if (!obj.has(var)) {
			return;
		}
		try {
			Double value = obj.getDouble(var);
			Parameters.<Double>put(var, value);
		} catch (JSONException e) {
			LOGGER.warning("Error parsing '" + var + "'. Falling back to default value.");
		}

	}

	public void setInteger(JSONObject obj, String var) {

		if (!obj.has(var)) {
			return;
		}
		try {
			Integer value = obj.getInt(var);
			Parameters.<Integer>put(var, value);
		} catch (JSONException e) {
			LOGGER.warning("Error parsing '" + var + "'. Falling back to default value.");
		}

	}

	public void setBoolean(JSONObject obj, String var) {

		if (!obj.has(var)) {
			return;
		}
		try {
			Boolean value = obj.getBoolean(var);
			Parameters.<Boolean>put(var, value);
		} catch (JSONException e) {
			LOGGER.warning("Error parsing '" + var + "'. Falling back to default value.");
		}

	}

}
