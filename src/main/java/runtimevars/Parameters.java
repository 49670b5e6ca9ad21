package runtimevars;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

public final class Parameters {

	private static final Logger LOGGER = Logger.getLogger(Parameters.class.getName());

	public static Map<String, Object> parameters = new HashMap<String, Object>();

	static {
		setDefaultParameters();
	}

	public static void setDefaultParameters() {

		// -------- input data -------- //
		parameters.put("undistortedImages", false); // Boolean

		// -------- session save data -------- //
		parameters.put("autosave", true); // Boolean
		parameters.put("savePath", ""); // String

		// -------- camera model -------- //
		parameters.put("undistortMaxIterations", 100); // Integer
		parameters.put("undistortTolerance", 1e-6); // Double (pixels)
		parameters.put("skewTolerance", 1e-6); // Double
		parameters.put("rotationDeterminantTolerance", 1e-3); // Double

		// -------- triangulation -------- //
		parameters.put("degenerateEpsilon", 1e-12); // Double
		parameters.put("parallelFrames", false); // Boolean

		// -------- status derivation -------- //
		parameters.put("statusRoundingDecimals", 3); // Integer

		// -------- logging -------- //
		parameters.put("logLevel", "INFO"); // String (java.util.logging level name)
	}

	public static void printParams() {
		StringBuilder sb = new StringBuilder("Parameters: ");
		Map<String, Object> sorted = new TreeMap<String, Object>(parameters);
		for (String key : sorted.keySet()) {
			sb.append(System.lineSeparator()).append(String.format("%-48s", key + ":")).append(sorted.get(key));
		}
		LOGGER.info(sb.toString());
	}

	@SuppressWarnings("unchecked")
	public static <T> T get(String var) {
		return (T) parameters.get(var);
	}

	public static <T> void put(String name, T var) {
		parameters.put(name, var);
	}

}
