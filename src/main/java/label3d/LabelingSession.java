package label3d;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import buffers.FrameSource;
import label3d.TriangulationReport.Outcome;
import runtimevars.Parameters;
import types.Callback;
import types.CameraCalibration;
import types.CameraObservation;
import types.DegenerateGeometryException;
import types.FramePack;
import types.InsufficientViewsException;
import types.InvalidCalibrationException;
import types.MarkerStatus;
import types.Observation;
import types.Point2D;
import types.Point3D;
import types.Skeleton;
import types.UndistortionDidNotConvergeException;

/**
 * A labeling session over a fixed set of cameras, markers and frames. Every edit goes through the
 * {@link CorrespondenceStore}; triangulation, reprojection and identity correction are composed
 * here so that the raw clicks that drive a solve are never overwritten by its reprojection.
 */
public class LabelingSession {

	private static final Logger LOGGER = Logger.getLogger(LabelingSession.class.getName());

	protected List<Camera> cameras;
	protected Skeleton skeleton;
	protected int nAnimals;
	protected int[] framesToLabel;
	protected CorrespondenceStore store;
	protected Triangulator triangulator;
	protected Reprojector reprojector;
	protected IdentityCorrection identityCorrection;
	protected FrameSource frameSource = null;
	protected List<Callback<LabelingSession>> changeCallbacks = new ArrayList<Callback<LabelingSession>>();

	public LabelingSession(List<Camera> cameras, Skeleton skeleton, int nAnimals, int[] framesToLabel) {
		if (cameras.isEmpty()) {
			throw new IllegalArgumentException("A session needs at least one camera");
		}
		if (nAnimals <= 0 || skeleton.getNumMarkers() % nAnimals != 0) {
			throw new IllegalArgumentException(
					"Marker count " + skeleton.getNumMarkers() + " is not a multiple of animal count " + nAnimals);
		}
		this.cameras = new ArrayList<Camera>(cameras);
		this.skeleton = skeleton;
		this.nAnimals = nAnimals;
		this.framesToLabel = framesToLabel.clone();
		this.store = new CorrespondenceStore(skeleton.getNumMarkers(), cameras.size(), framesToLabel.length);
		this.triangulator = new Triangulator(this.cameras);
		this.reprojector = new Reprojector(this.store, this.cameras);
		this.identityCorrection = new IdentityCorrection(this.store, nAnimals);
	}

	public LabelingSession(List<Camera> cameras, Skeleton skeleton, int nAnimals, int nFrames) {
		this(cameras, skeleton, nAnimals, IntStream.range(0, nFrames).toArray());
	}

	public static LabelingSession fromCalibrations(List<CameraCalibration> calibrations, Skeleton skeleton,
			int nAnimals, int[] framesToLabel) throws InvalidCalibrationException {
		List<Camera> cameras = new ArrayList<Camera>();
		for (CameraCalibration calibration : calibrations) {
			cameras.add(Camera.resolvePose(calibration));
		}
		return new LabelingSession(cameras, skeleton, nAnimals, framesToLabel);
	}

	public static LabelingSession fromCalibrations(List<CameraCalibration> calibrations, Skeleton skeleton,
			int nAnimals, int nFrames) throws InvalidCalibrationException {
		return fromCalibrations(calibrations, skeleton, nAnimals, IntStream.range(0, nFrames).toArray());
	}

	// ----------------------------- edits ----------------------------- //

	// a direct user click or drag
	public boolean clickImage(int marker, int cam, int frame, Point2D pos) {
		boolean placed = this.store.placeObservation(marker, cam, frame, pos, true);
		if (!placed) {
			LOGGER.fine("Ignoring click on invisible marker " + marker + " in camera " + cam);
		}
		return placed;
	}

	public void deleteObservation(int marker, int cam, int frame) {
		this.store.resetObservation(marker, cam, frame);
	}

	public boolean toggleInvisible(int marker, int frame) {
		boolean invisible = this.store.toggleInvisible(marker, frame);
		this.triggerChanged();
		return invisible;
	}

	public void resetMarker(int marker, int frame) {
		this.store.resetMarker(marker, frame);
		this.triggerChanged();
	}

	public void resetFrame(int frame) {
		this.store.resetFrame(frame);
		this.triggerChanged();
	}

	public void acceptFrame(int frame) {
		this.store.acceptFrame(frame);
		this.triggerChanged();
	}

	/**
	 * Swaps the two animals' markers in one view, then re-triangulates the frame so 3D points and
	 * the other views follow.
	 */
	public TriangulationReport swapAnimalIdentities(int cam, int frame) {
		this.identityCorrection.swapAnimals(cam, frame);
		TriangulationReport report = this.triangulateFrameSilently(frame);
		this.triggerChanged();
		return report;
	}

	// ----------------------------- triangulation ----------------------------- //

	public TriangulationReport triangulateFrame(int frame) {
		TriangulationReport report = this.triangulateFrameSilently(frame);
		this.triggerChanged();
		return report;
	}

	public Outcome triangulateMarker(int marker, int frame) {
		Outcome outcome = this.solveAndReproject(marker, frame, -1);
		this.triggerChanged();
		return outcome;
	}

	/**
	 * Triangulation while the user holds a node in one view: that view dominates the solve.
	 */
	public Outcome triangulateHeld(int cam, int marker, int frame) {
		if (!this.store.getStatus(marker, cam, frame).isEligible()) {
			LOGGER.fine("Held camera " + cam + " has no usable observation for marker " + marker);
			return Outcome.INSUFFICIENT_VIEWS;
		}
		Outcome outcome = this.solveAndReproject(marker, frame, cam);
		this.triggerChanged();
		return outcome;
	}

	// batch re-triangulation of every frame. frames share no state so they may run in parallel
	public TriangulationReport triangulateAllFrames() {
		IntStream frames = IntStream.range(0, this.getNumFrames());
		if (Parameters.<Boolean>get("parallelFrames")) {
			frames = frames.parallel();
		}
		List<TriangulationReport> reports = frames.mapToObj(f -> this.triangulateFrameSilently(f))
				.collect(Collectors.toList());
		TriangulationReport report = new TriangulationReport();
		for (TriangulationReport r : reports) {
			report.merge(r);
		}
		LOGGER.info("Re-triangulated " + this.getNumFrames() + " frames: " + report);
		this.triggerChanged();
		return report;
	}

	/**
	 * Eligible observations of a marker, undistorted unless the images already are. A pixel whose
	 * undistortion does not converge is used as is.
	 */
	public List<CameraObservation> getPointTrack(int marker, int frame) {
		boolean undistorted = Parameters.<Boolean>get("undistortedImages");
		List<CameraObservation> track = new ArrayList<CameraObservation>();
		for (int cam : this.store.getEligibleCameras(marker, frame)) {
			Point2D pixel = this.store.getPosition(marker, cam, frame);
			if (!undistorted) {
				try {
					pixel = this.cameras.get(cam).undistort(pixel);
				} catch (UndistortionDidNotConvergeException e) {
					LOGGER.warning(e.getMessage() + ". Using the distorted coordinate for camera " + cam);
				}
			}
			track.add(new CameraObservation(cam, pixel));
		}
		return track;
	}

	protected TriangulationReport triangulateFrameSilently(int frame) {
		TriangulationReport report = new TriangulationReport();
		for (int marker = 0; marker < this.store.getNumMarkers(); marker++) {
			report.record(marker, frame, this.solveAndReproject(marker, frame, -1));
		}
		return report;
	}

	// heldCamera < 0 means an unweighted solve
	protected Outcome solveAndReproject(int marker, int frame, int heldCamera) {

		List<Integer> eligible = this.store.getEligibleCameras(marker, frame);
		if (eligible.size() < 2) {
			return Outcome.INSUFFICIENT_VIEWS;
		}

		// raw observations that feed this solve, restored verbatim after reprojection
		List<Observation> raw = new ArrayList<Observation>();
		for (int cam : eligible) {
			raw.add(this.store.getObservation(marker, cam, frame));
		}

		Point3D point;
		try {
			List<CameraObservation> track = this.getPointTrack(marker, frame);
			point = heldCamera < 0 ? this.triangulator.triangulate(marker, frame, track)
					: this.triangulator.forceTriangulate(marker, frame, track, heldCamera);
		} catch (InsufficientViewsException e) {
			return Outcome.INSUFFICIENT_VIEWS;
		} catch (DegenerateGeometryException e) {
			LOGGER.warning(e.getMessage() + ". Keeping the previous 3D point.");
			return Outcome.DEGENERATE;
		}

		CorrespondenceStore.FrameSnapshot snapshot = this.store.snapshotFrame(frame);
		try {
			this.store.setPoint3D(marker, frame, point);
			this.reprojector.reprojectAll(marker, frame);
			for (int i = 0; i < eligible.size(); i++) {
				this.store.setObservation(marker, eligible.get(i), frame, raw.get(i));
			}
		} catch (RuntimeException e) {
			this.store.restoreFrame(snapshot);
			LOGGER.log(Level.SEVERE, "Reprojection of marker " + marker + " frame " + frame + " failed", e);
			throw e;
		}
		return Outcome.TRIANGULATED;
	}

	// ----------------------------- loading ----------------------------- //

	/**
	 * Seeds the session from prior 3D points, laid out [frame][3 * marker + axis]. Each point
	 * is projected into the views as an INITIALIZED observation whose initial position is the
	 * projection itself. Markers with a LABELED view keep their state, as do invisible views.
	 */
	public int loadFrom3D(double[][] data3D) {
		int nMarkers = this.store.getNumMarkers();
		if (data3D.length != this.getNumFrames()) {
			throw new IllegalArgumentException(
					"Expected 3D data for " + this.getNumFrames() + " frames, got " + data3D.length);
		}
		// the whole array is checked before anything is written
		for (int frame = 0; frame < data3D.length; frame++) {
			if (data3D[frame] == null || data3D[frame].length != 3 * nMarkers) {
				throw new IllegalArgumentException("Frame " + frame + " has "
						+ (data3D[frame] == null ? 0 : data3D[frame].length) + " values, expected " + 3 * nMarkers);
			}
		}
		boolean applyDistortion = !Parameters.<Boolean>get("undistortedImages");
		int loaded = 0;
		for (int frame = 0; frame < data3D.length; frame++) {
			for (int marker = 0; marker < nMarkers; marker++) {
				Point3D point = new Point3D(data3D[frame][3 * marker], data3D[frame][3 * marker + 1],
						data3D[frame][3 * marker + 2]);
				if (!point.isFinite() || this.hasLabeledView(marker, frame) || this.store.isInvisible(marker, frame)) {
					continue;
				}
				this.store.setPoint3D(marker, frame, point);
				for (int cam = 0; cam < this.cameras.size(); cam++) {
					if (this.store.getStatus(marker, cam, frame) == MarkerStatus.INVISIBLE) {
						continue;
					}
					Point2D pixel = this.reprojector.reproject(point, this.cameras.get(cam), applyDistortion);
					if (!pixel.isFinite()) {
						continue;
					}
					this.store.setInitialPosition(marker, cam, frame, pixel);
					this.store.setObservation(marker, cam, frame, pixel, MarkerStatus.INITIALIZED);
				}
				loaded++;
			}
		}
		LOGGER.info("Initialized " + loaded + " marker positions from 3D data");
		return loaded;
	}

	private boolean hasLabeledView(int marker, int frame) {
		for (int cam = 0; cam < this.cameras.size(); cam++) {
			if (this.store.getStatus(marker, cam, frame) == MarkerStatus.LABELED) {
				return true;
			}
		}
		return false;
	}

	// ----------------------------- video ----------------------------- //

	public FramePack getVideoFrame(int cam, int frame) {
		if (this.frameSource == null) {
			throw new IllegalStateException("No frame source attached to this session");
		}
		if (frame < 0 || frame >= this.framesToLabel.length) {
			throw new IndexOutOfBoundsException("Frame " + frame + " outside [0, " + this.framesToLabel.length + ")");
		}
		return this.frameSource.getFrame(cam, this.framesToLabel[frame]);
	}

	public void setFrameSource(FrameSource frameSource) {
		if (frameSource != null && frameSource.getNumViews() != this.cameras.size()) {
			throw new IllegalArgumentException(
					"Frame source has " + frameSource.getNumViews() + " views, session has " + this.cameras.size());
		}
		this.frameSource = frameSource;
	}

	// ----------------------------- callbacks ----------------------------- //

	public void whenChanged(Callback<LabelingSession> cb) {
		this.changeCallbacks.add(cb);
	}

	protected void triggerChanged() {
		for (Callback<LabelingSession> cb : this.changeCallbacks) {
			cb.callback(this);
		}
	}

	// ----------------------------- accessors ----------------------------- //

	public StatusSummary getStatusSummary() {
		return new StatusSummary(this.store);
	}

	public CorrespondenceStore getStore() {
		return store;
	}

	public List<Camera> getCameras() {
		return Collections.unmodifiableList(cameras);
	}

	public Skeleton getSkeleton() {
		return skeleton;
	}

	public int getNumAnimals() {
		return nAnimals;
	}

	public int getNumMarkers() {
		return this.store.getNumMarkers();
	}

	public int getNumCams() {
		return this.cameras.size();
	}

	public int getNumFrames() {
		return this.framesToLabel.length;
	}

	public int[] getFramesToLabel() {
		return framesToLabel.clone();
	}

}
