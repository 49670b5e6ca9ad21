package runtimevars;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ParamReaderTest {

	@TempDir
	Path tempDir;

	@AfterEach
	public void resetParameters() {
		Parameters.setDefaultParameters();
	}

	@Test
	public void readsParameterFile() throws Exception {
		File file = new File(ParamReaderTest.class.getResource("/params.json").toURI());
		new ParamReader().setParameters(file.getPath());

		assertTrue(Parameters.<Boolean>get("undistortedImages"));
		assertFalse(Parameters.<Boolean>get("autosave"));
		assertEquals("sessions", Parameters.<String>get("savePath"));
		assertEquals(250, (int) Parameters.<Integer>get("undistortMaxIterations"));
		assertEquals(1e-8, Parameters.<Double>get("undistortTolerance"), 0);
		assertTrue(Parameters.<Boolean>get("parallelFrames"));
		assertEquals("FINE", Parameters.<String>get("logLevel"));

		// unparseable value keeps the default
		assertEquals(3, (int) Parameters.<Integer>get("statusRoundingDecimals"));
		// absent keys keep their defaults
		assertEquals(1e-12, Parameters.<Double>get("degenerateEpsilon"), 0);
	}

	@Test
	public void missingFileKeepsDefaults() {
		new ParamReader().setParameters(this.tempDir.resolve("absent.json").toString());
		assertTrue(Parameters.<Boolean>get("autosave"));
		assertEquals(100, (int) Parameters.<Integer>get("undistortMaxIterations"));
	}

	@Test
	public void malformedFileKeepsDefaults() throws Exception {
		Path file = this.tempDir.resolve("broken.json");
		Files.write(file, "{ \"autosave\": fals".getBytes(StandardCharsets.UTF_8));
		new ParamReader().setParameters(file.toString());
		assertTrue(Parameters.<Boolean>get("autosave"));
	}

	@Test
	public void readsJSONObjectDirectly() {
		JSONObject obj = new JSONObject();
		obj.put("degenerateEpsilon", 1e-9);
		obj.put("skewTolerance", "wide");
		new ParamReader().setParameters(obj);
		assertEquals(1e-9, Parameters.<Double>get("degenerateEpsilon"), 0);
		assertEquals(1e-6, Parameters.<Double>get("skewTolerance"), 0);
	}

}
