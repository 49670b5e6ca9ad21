import java.io.File;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import datarecording.SessionRecorder;
import label3d.LabelingSession;
import label3d.TriangulationReport;
import mock.MockFrameSource;
import mock.MockRig;
import runtimevars.ParamReader;
import runtimevars.Parameters;
import toolbox.LoggerSetup;

/**
 * Command line entry point for batch work on saved sessions.
 *
 * -config file : JSON parameter overrides
 * -session file : session to load
 * -retriangulate : re-triangulate every frame of the session and save it
 * -mock : build a synthetic session, label it from its own projections and save it
 */
public class Label3DBootstrapper {

	private static final Logger LOGGER = Logger.getLogger(Label3DBootstrapper.class.getName());

	private String sessionPath = null;
	private boolean retriangulate = false;
	private boolean mock = false;

	public void start() throws Exception {

		SessionRecorder recorder = new SessionRecorder();
		LabelingSession session;

		if (this.mock) {
			session = this.buildMockSession();
		} else if (this.sessionPath != null) {
			session = recorder.load(new File(this.sessionPath));
			LOGGER.info("Loaded session with " + session.getNumCams() + " cameras, " + session.getNumMarkers()
					+ " markers, " + session.getNumFrames() + " frames");
		} else {
			LOGGER.warning("Nothing to do: pass -session <file> or -mock.");
			return;
		}

		if (this.retriangulate || this.mock) {
			TriangulationReport report = session.triangulateAllFrames();
			if (!report.getDegenerate().isEmpty()) {
				LOGGER.warning(report.getDegenerate().size() + " marker/frame pairs had degenerate geometry");
			}
		}

		File saved = recorder.save(session);
		LOGGER.info("Done. Labeled frames: " + session.getStatusSummary().getLabeledFrames() + ", saved to "
				+ saved.getPath());
	}

	private LabelingSession buildMockSession() throws Exception {
		int nAnimals = 2;
		int markersPerAnimal = 5;
		int nFrames = 10;
		MockRig rig = new MockRig(4, 2.0, 1.0);
		double[][] points = MockRig.syntheticPoints(nAnimals, markersPerAnimal, nFrames, 42L);
		LabelingSession session = LabelingSession.fromCalibrations(rig.getCalibrations(),
				MockRig.chainSkeleton(nAnimals, markersPerAnimal), nAnimals, nFrames);
		session.setFrameSource(new MockFrameSource(session.getCameras(), points));
		session.loadFrom3D(points);
		for (int frame = 0; frame < nFrames; frame++) {
			session.acceptFrame(frame);
		}
		return session;
	}

	public void handleArgs(String[] args) throws Exception {

		List<String> listArgs = Arrays.asList(args);

		if (listArgs.indexOf("-config") != -1) {

			if (listArgs.size() <= listArgs.indexOf("-config") + 1) {
				throw new IllegalArgumentException("-config argument must be followed by path to config file.");
			}

			ParamReader paramReader = new ParamReader();
			paramReader.setParameters(listArgs.get(listArgs.indexOf("-config") + 1));
		}

		if (listArgs.indexOf("-session") != -1) {

			if (listArgs.size() <= listArgs.indexOf("-session") + 1) {
				throw new IllegalArgumentException("-session argument must be followed by path to a session file.");
			}

			this.sessionPath = listArgs.get(listArgs.indexOf("-session") + 1);
		}

		this.retriangulate = listArgs.contains("-retriangulate");
		this.mock = listArgs.contains("-mock");

	}

	public static void main(String[] args) throws Exception {

		Label3DBootstrapper bootstrapper = new Label3DBootstrapper();

		Parameters.setDefaultParameters();
		bootstrapper.handleArgs(args);
		LoggerSetup.setupLogger();
		Parameters.printParams();

		bootstrapper.start();

	}

}
