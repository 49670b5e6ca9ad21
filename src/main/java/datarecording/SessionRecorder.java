package datarecording;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import Jama.Matrix;
import label3d.Camera;
import label3d.CorrespondenceStore;
import label3d.LabelingSession;
import runtimevars.Parameters;
import types.Callback;
import types.CameraCalibration;
import types.CameraCalibration.PoseConvention;
import types.InvalidCalibrationException;
import types.MarkerStatus;
import types.Observation;
import types.Point2D;
import types.Point3D;
import types.Pose;
import types.Skeleton;

/**
 * Reads and writes session snapshots as JSON. Absent coordinates are written as null.
 *
 * Registered with {@link LabelingSession#whenChanged(Callback)} it autosaves after every
 * triangulation, swap, invisibility toggle, reset and frame acceptance.
 */
public class SessionRecorder implements Callback<LabelingSession> {

	private static final Logger LOGGER = Logger.getLogger(SessionRecorder.class.getName());

	public static final String FILE_SUFFIX = "_Label3D.json";

	private File lastSaved = null;

	@Override
	public void callback(LabelingSession session) {
		if (!Parameters.<Boolean>get("autosave")) {
			return;
		}
		try {
			this.save(session);
		} catch (IOException e) {
			// the session stays valid in memory, the next change retries
			LOGGER.log(Level.SEVERE, "Autosave failed", e);
		}
	}

	public File save(LabelingSession session) throws IOException {
		String datePattern = "yyyyMMdd_HHmmss";
		SimpleDateFormat sdf = new SimpleDateFormat(datePattern);
		File file = new File(Parameters.<String>get("savePath"), sdf.format(new Date()) + FILE_SUFFIX);
		this.save(session, file);
		return file;
	}

	public void save(LabelingSession session, File file) throws IOException {
		if (file.getParentFile() != null) {
			Files.createDirectories(file.getParentFile().toPath());
		}
		Files.write(file.toPath(), this.toJSON(session).toString(2).getBytes(StandardCharsets.UTF_8));
		this.lastSaved = file;
		LOGGER.info("Saved session to " + file.getPath());
	}

	public LabelingSession load(File file) throws IOException, InvalidCalibrationException {
		String json = FileUtils.readFileToString(file, "utf-8");
		try {
			return this.fromJSON(new JSONObject(json));
		} catch (JSONException e) {
			throw new IOException("Malformed session file " + file.getPath(), e);
		}
	}

	/**
	 * Concatenates the frames of several sessions that share cameras and skeleton.
	 */
	public LabelingSession merge(List<File> files) throws IOException, InvalidCalibrationException {
		if (files.isEmpty()) {
			throw new IllegalArgumentException("Nothing to merge");
		}
		List<LabelingSession> sessions = new ArrayList<LabelingSession>();
		List<Integer> frames = new ArrayList<Integer>();
		for (File file : files) {
			LabelingSession s = this.load(file);
			LabelingSession first = sessions.isEmpty() ? s : sessions.get(0);
			if (s.getNumCams() != first.getNumCams() || s.getNumMarkers() != first.getNumMarkers()
					|| s.getNumAnimals() != first.getNumAnimals()) {
				throw new IllegalArgumentException("Session " + file.getPath() + " has a different layout than "
						+ files.get(0).getPath());
			}
			sessions.add(s);
			for (int f : s.getFramesToLabel()) {
				frames.add(f);
			}
		}

		LabelingSession first = sessions.get(0);
		LabelingSession merged = new LabelingSession(first.getCameras(), first.getSkeleton(), first.getNumAnimals(),
				frames.stream().mapToInt(Integer::intValue).toArray());

		int offset = 0;
		for (LabelingSession s : sessions) {
			for (int frame = 0; frame < s.getNumFrames(); frame++) {
				copyFrame(s.getStore(), frame, merged.getStore(), offset + frame);
			}
			offset += s.getNumFrames();
		}
		LOGGER.info("Merged " + files.size() + " sessions into " + merged.getNumFrames() + " frames");
		return merged;
	}

	// ----------------------------- JSON writing ----------------------------- //

	public JSONObject toJSON(LabelingSession session) {

		CorrespondenceStore store = session.getStore();
		int nMarkers = store.getNumMarkers();
		int nCams = store.getNumCams();
		int nFrames = store.getNumFrames();

		JSONObject obj = new JSONObject();

		JSONArray cameraParameters = new JSONArray();
		for (Camera camera : session.getCameras()) {
			cameraParameters.put(this.cameraToJSON(camera));
		}
		obj.put("cameraParameters", cameraParameters);
		obj.put("nAnimals", session.getNumAnimals());
		obj.put("framesToLabel", new JSONArray(session.getFramesToLabel()));
		obj.put("skeleton", this.skeletonToJSON(session.getSkeleton()));

		JSONArray status = new JSONArray();
		JSONArray handLabeled2D = new JSONArray();
		JSONArray camPoints = new JSONArray();
		JSONArray initialPoints = new JSONArray();
		for (int marker = 0; marker < nMarkers; marker++) {
			JSONArray statusM = new JSONArray();
			JSONArray handM = new JSONArray();
			JSONArray camM = new JSONArray();
			JSONArray initM = new JSONArray();
			for (int cam = 0; cam < nCams; cam++) {
				JSONArray statusC = new JSONArray();
				JSONArray[] handC = { new JSONArray(), new JSONArray() };
				JSONArray[] camC = { new JSONArray(), new JSONArray() };
				JSONArray[] initC = { new JSONArray(), new JSONArray() };
				for (int frame = 0; frame < nFrames; frame++) {
					Observation o = store.getObservation(marker, cam, frame);
					statusC.put(o.getStatus().getCode());
					Point2D hand = o.isHandLabeled() && o.getStatus() == MarkerStatus.LABELED ? o.getPosition() : null;
					putPoint(handC, hand);
					putPoint(camC, o.getPosition());
					putPoint(initC, store.getInitialPosition(marker, cam, frame));
				}
				statusM.put(statusC);
				handM.put(new JSONArray().put(handC[0]).put(handC[1]));
				camM.put(new JSONArray().put(camC[0]).put(camC[1]));
				initM.put(new JSONArray().put(initC[0]).put(initC[1]));
			}
			status.put(statusM);
			handLabeled2D.put(handM);
			camPoints.put(camM);
			initialPoints.put(initM);
		}
		obj.put("status", status);
		obj.put("handLabeled2D", handLabeled2D);
		obj.put("camPoints", camPoints);
		obj.put("initialPoints", initialPoints);

		// data_3D only carries points labeled in every view, points3D carries everything
		JSONArray data3D = new JSONArray();
		JSONArray points3D = new JSONArray();
		for (int frame = 0; frame < nFrames; frame++) {
			JSONArray dataF = new JSONArray();
			JSONArray pointsF = new JSONArray();
			for (int marker = 0; marker < nMarkers; marker++) {
				Point3D p = store.getPoint3D(marker, frame);
				putPoint(pointsF, p);
				putPoint(dataF, store.isFullyLabeled(marker, frame) ? p : null);
			}
			data3D.put(dataF);
			points3D.put(pointsF);
		}
		obj.put("data_3D", data3D);
		obj.put("points3D", points3D);

		return obj;
	}

	private JSONObject cameraToJSON(Camera camera) {
		CameraCalibration c = camera.getCalibration();
		JSONObject cameraJSON = new JSONObject();
		cameraJSON.put("name", c.getName());
		cameraJSON.put("K", matrixToJSON(c.getK()));
		cameraJSON.put("RDistort", new JSONArray(c.getRadialDistortion()));
		cameraJSON.put("TDistort", new JSONArray(c.getTangentialDistortion()));
		cameraJSON.put("r", c.isRodrigues() ? new JSONArray(c.getRotation().getRowPackedCopy())
				: matrixToJSON(c.getRotation()));
		cameraJSON.put("t", new JSONArray(c.getTranslation().getRowPackedCopy()));
		cameraJSON.put("imageSize", new JSONArray(new int[] { c.getImageHeight(), c.getImageWidth() }));
		cameraJSON.put("convention", c.getConvention().name());

		// resolved world pose, for reference only
		Pose pose = camera.worldPose();
		Matrix q = pose.getQuaternion();
		JSONObject poseJSON = new JSONObject();
		poseJSON.put("Cx", pose.getCx());
		poseJSON.put("Cy", pose.getCy());
		poseJSON.put("Cz", pose.getCz());
		poseJSON.put("qw", q.get(0, 0));
		poseJSON.put("qx", q.get(1, 0));
		poseJSON.put("qy", q.get(2, 0));
		poseJSON.put("qz", q.get(3, 0));
		cameraJSON.put("pose", poseJSON);
		return cameraJSON;
	}

	private JSONObject skeletonToJSON(Skeleton skeleton) {
		JSONObject skeletonJSON = new JSONObject();
		skeletonJSON.put("joint_names", new JSONArray(skeleton.getJointNames()));
		JSONArray joints = new JSONArray();
		for (int[] segment : skeleton.getSegments()) {
			joints.put(new JSONArray(segment));
		}
		skeletonJSON.put("joints_idx", joints);
		JSONArray colors = new JSONArray();
		for (double[] color : skeleton.getSegmentColors()) {
			colors.put(new JSONArray(color));
		}
		skeletonJSON.put("color", colors);
		JSONArray markerColors = new JSONArray();
		for (double[] color : skeleton.getMarkerColors()) {
			markerColors.put(new JSONArray(color));
		}
		skeletonJSON.put("marker_colors", markerColors);
		return skeletonJSON;
	}

	// ----------------------------- JSON reading ----------------------------- //

	public LabelingSession fromJSON(JSONObject obj) throws InvalidCalibrationException {

		List<CameraCalibration> calibrations = new ArrayList<CameraCalibration>();
		JSONArray cameraParameters = obj.getJSONArray("cameraParameters");
		for (int i = 0; i < cameraParameters.length(); i++) {
			calibrations.add(this.calibrationFromJSON(cameraParameters.getJSONObject(i)));
		}
		Skeleton skeleton = this.skeletonFromJSON(obj.getJSONObject("skeleton"));
		int nAnimals = obj.optInt("nAnimals", 1);

		JSONArray status = obj.getJSONArray("status");
		int nFrames = status.getJSONArray(0).getJSONArray(0).length();
		int[] framesToLabel = new int[nFrames];
		JSONArray frames = obj.optJSONArray("framesToLabel");
		for (int f = 0; f < nFrames; f++) {
			framesToLabel[f] = frames == null ? f : frames.getInt(f);
		}

		LabelingSession session = LabelingSession.fromCalibrations(calibrations, skeleton, nAnimals, framesToLabel);
		CorrespondenceStore store = session.getStore();

		if (obj.has("camPoints")) {
			this.readLossless(obj, store);
		} else {
			this.readFrom3D(obj, session);
		}
		return session;
	}

	// sessions written by this recorder carry every 2D and 3D coordinate
	private void readLossless(JSONObject obj, CorrespondenceStore store) {
		JSONArray status = obj.getJSONArray("status");
		JSONArray hand = obj.getJSONArray("handLabeled2D");
		JSONArray camPoints = obj.getJSONArray("camPoints");
		JSONArray initialPoints = obj.optJSONArray("initialPoints");
		for (int marker = 0; marker < store.getNumMarkers(); marker++) {
			for (int cam = 0; cam < store.getNumCams(); cam++) {
				for (int frame = 0; frame < store.getNumFrames(); frame++) {
					MarkerStatus s = MarkerStatus
							.fromCode(status.getJSONArray(marker).getJSONArray(cam).getInt(frame));
					Point2D pos = getPoint(camPoints.getJSONArray(marker).getJSONArray(cam), frame);
					boolean byHand = getPoint(hand.getJSONArray(marker).getJSONArray(cam), frame) != null;
					store.setObservation(marker, cam, frame, new Observation(pos, s, byHand));
					if (initialPoints != null) {
						store.setInitialPosition(marker, cam, frame,
								getPoint(initialPoints.getJSONArray(marker).getJSONArray(cam), frame));
					}
				}
			}
		}
		JSONArray points3D = obj.has("points3D") ? obj.getJSONArray("points3D") : obj.getJSONArray("data_3D");
		for (int frame = 0; frame < store.getNumFrames(); frame++) {
			double[] values = toDoubleArray(points3D.getJSONArray(frame));
			for (int marker = 0; marker < store.getNumMarkers(); marker++) {
				Point3D p = new Point3D(values[3 * marker], values[3 * marker + 1], values[3 * marker + 2]);
				store.setPoint3D(marker, frame, p.isFinite() ? p : null);
			}
		}
	}

	// files without raw 2D: back-project data_3D, then overlay the hand labels and statuses
	private void readFrom3D(JSONObject obj, LabelingSession session) {
		CorrespondenceStore store = session.getStore();
		JSONArray data3D = obj.getJSONArray("data_3D");
		double[][] values = new double[data3D.length()][];
		for (int frame = 0; frame < data3D.length(); frame++) {
			values[frame] = toDoubleArray(data3D.getJSONArray(frame));
		}
		session.loadFrom3D(values);

		JSONArray status = obj.getJSONArray("status");
		JSONArray hand = obj.optJSONArray("handLabeled2D");
		for (int marker = 0; marker < store.getNumMarkers(); marker++) {
			for (int cam = 0; cam < store.getNumCams(); cam++) {
				for (int frame = 0; frame < store.getNumFrames(); frame++) {
					MarkerStatus s = MarkerStatus
							.fromCode(status.getJSONArray(marker).getJSONArray(cam).getInt(frame));
					Point2D handPos = hand == null ? null : getPoint(hand.getJSONArray(marker).getJSONArray(cam), frame);
					if (handPos != null) {
						store.setObservation(marker, cam, frame, new Observation(handPos, MarkerStatus.LABELED, true));
					} else if (s == MarkerStatus.INVISIBLE) {
						store.setObservation(marker, cam, frame, null, MarkerStatus.INVISIBLE);
					} else if (s == MarkerStatus.LABELED && store.getPosition(marker, cam, frame) != null) {
						store.setObservation(marker, cam, frame, store.getPosition(marker, cam, frame),
								MarkerStatus.LABELED);
					}
				}
			}
		}
	}

	private CameraCalibration calibrationFromJSON(JSONObject cameraJSON) {
		CameraCalibration c = new CameraCalibration();
		c.setName(cameraJSON.optString("name", ""));
		c.setK(matrixFromJSON(cameraJSON.getJSONArray("K")));
		c.setRadialDistortion(toDoubleArray(cameraJSON.getJSONArray("RDistort")));
		JSONArray tangential = cameraJSON.optJSONArray("TDistort");
		c.setTangentialDistortion(tangential == null ? new double[0] : toDoubleArray(tangential));
		JSONArray r = cameraJSON.getJSONArray("r");
		if (r.length() > 0 && r.get(0) instanceof JSONArray) {
			c.setRotation(matrixFromJSON(r));
		} else {
			c.setRotation(new Matrix(toDoubleArray(r), 3));
		}
		c.setTranslation(new Matrix(toDoubleArray(cameraJSON.getJSONArray("t")), 3));
		JSONArray imageSize = cameraJSON.optJSONArray("imageSize");
		if (imageSize != null) {
			c.setImageHeight(imageSize.getInt(0));
			c.setImageWidth(imageSize.getInt(1));
		}
		c.setConvention(PoseConvention.valueOf(cameraJSON.optString("convention", PoseConvention.COLUMN_VECTOR.name())));
		return c;
	}

	private Skeleton skeletonFromJSON(JSONObject skeletonJSON) {
		JSONArray names = skeletonJSON.getJSONArray("joint_names");
		List<String> jointNames = new ArrayList<String>();
		for (int i = 0; i < names.length(); i++) {
			jointNames.add(names.getString(i));
		}
		Skeleton skeleton = new Skeleton(jointNames);
		JSONArray joints = skeletonJSON.optJSONArray("joints_idx");
		JSONArray colors = skeletonJSON.optJSONArray("color");
		for (int i = 0; joints != null && i < joints.length(); i++) {
			double[] color = colors != null && i < colors.length() ? toDoubleArray(colors.getJSONArray(i))
					: new double[] { 1, 1, 1 };
			skeleton.addSegment(joints.getJSONArray(i).getInt(0), joints.getJSONArray(i).getInt(1), color[0], color[1],
					color[2]);
		}
		JSONArray markerColors = skeletonJSON.optJSONArray("marker_colors");
		for (int i = 0; markerColors != null && i < markerColors.length(); i++) {
			double[] color = toDoubleArray(markerColors.getJSONArray(i));
			skeleton.setMarkerColor(i, color[0], color[1], color[2]);
		}
		return skeleton;
	}

	// ----------------------------- helpers ----------------------------- //

	private static void copyFrame(CorrespondenceStore src, int srcFrame, CorrespondenceStore dst, int dstFrame) {
		for (int marker = 0; marker < src.getNumMarkers(); marker++) {
			for (int cam = 0; cam < src.getNumCams(); cam++) {
				dst.setObservation(marker, cam, dstFrame, src.getObservation(marker, cam, srcFrame));
				dst.setInitialPosition(marker, cam, dstFrame, src.getInitialPosition(marker, cam, srcFrame));
			}
			dst.setPoint3D(marker, dstFrame, src.getPoint3D(marker, srcFrame));
		}
	}

	private static void putPoint(JSONArray[] xy, Point2D p) {
		xy[0].put(p == null ? JSONObject.NULL : p.getX());
		xy[1].put(p == null ? JSONObject.NULL : p.getY());
	}

	private static void putPoint(JSONArray array, Point3D p) {
		array.put(p == null ? JSONObject.NULL : p.getX());
		array.put(p == null ? JSONObject.NULL : p.getY());
		array.put(p == null ? JSONObject.NULL : p.getZ());
	}

	private static Point2D getPoint(JSONArray xy, int frame) {
		JSONArray xs = xy.getJSONArray(0);
		JSONArray ys = xy.getJSONArray(1);
		if (xs.isNull(frame) || ys.isNull(frame)) {
			return null;
		}
		return new Point2D(xs.getDouble(frame), ys.getDouble(frame));
	}

	private static double[] toDoubleArray(JSONArray array) {
		double[] values = new double[array.length()];
		for (int i = 0; i < array.length(); i++) {
			values[i] = array.isNull(i) ? Double.NaN : array.getDouble(i);
		}
		return values;
	}

	private static JSONArray matrixToJSON(Matrix m) {
		JSONArray rows = new JSONArray();
		for (int i = 0; i < m.getRowDimension(); i++) {
			JSONArray row = new JSONArray();
			for (int j = 0; j < m.getColumnDimension(); j++) {
				row.put(m.get(i, j));
			}
			rows.put(row);
		}
		return rows;
	}

	private static Matrix matrixFromJSON(JSONArray rows) {
		Matrix m = new Matrix(rows.length(), rows.getJSONArray(0).length());
		for (int i = 0; i < rows.length(); i++) {
			for (int j = 0; j < rows.getJSONArray(i).length(); j++) {
				m.set(i, j, rows.getJSONArray(i).getDouble(j));
			}
		}
		return m;
	}

	public File getLastSaved() {
		return lastSaved;
	}

}
