package label3d;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import runtimevars.Parameters;
import toolbox.Utils;
import types.MarkerStatus;
import types.Observation;
import types.Point2D;
import types.Point3D;

/**
 * Dense per-(marker, camera, frame) 2D state plus the per-(marker, frame) 3D estimates.
 *
 * Storage is frame major so a frame's slice is contiguous: frames are independent and can be
 * processed from different threads as long as no two threads share a frame. Absent coordinates
 * are NaN.
 */
public class CorrespondenceStore {

	private static final Logger LOGGER = Logger.getLogger(CorrespondenceStore.class.getName());

	private final int nMarkers;
	private final int nCams;
	private final int nFrames;

	private final double[] posX;
	private final double[] posY;
	private final double[] initX;
	private final double[] initY;
	private final byte[] status;
	private final boolean[] handLabeled;

	private final double[] pointX;
	private final double[] pointY;
	private final double[] pointZ;

	public CorrespondenceStore(int nMarkers, int nCams, int nFrames) {
		if (nMarkers <= 0 || nCams <= 0 || nFrames <= 0) {
			throw new IllegalArgumentException(
					"Store dimensions must be positive: " + nMarkers + " x " + nCams + " x " + nFrames);
		}
		this.nMarkers = nMarkers;
		this.nCams = nCams;
		this.nFrames = nFrames;

		int n2d = nMarkers * nCams * nFrames;
		this.posX = nanArray(n2d);
		this.posY = nanArray(n2d);
		this.initX = nanArray(n2d);
		this.initY = nanArray(n2d);
		this.status = new byte[n2d];
		this.handLabeled = new boolean[n2d];

		int n3d = nMarkers * nFrames;
		this.pointX = nanArray(n3d);
		this.pointY = nanArray(n3d);
		this.pointZ = nanArray(n3d);
	}

	// ----------------------------- observations ----------------------------- //

	public Observation getObservation(int marker, int cam, int frame) {
		int i = this.index(marker, cam, frame);
		return new Observation(this.position(i), MarkerStatus.values()[this.status[i]], this.handLabeled[i]);
	}

	public Point2D getPosition(int marker, int cam, int frame) {
		return this.position(this.index(marker, cam, frame));
	}

	public MarkerStatus getStatus(int marker, int cam, int frame) {
		return MarkerStatus.values()[this.status[this.index(marker, cam, frame)]];
	}

	public boolean isHandLabeled(int marker, int cam, int frame) {
		return this.handLabeled[this.index(marker, cam, frame)];
	}

	/**
	 * Raw write of a position and status. The pair must satisfy: position absent exactly when the
	 * status is UNLABELED or INVISIBLE. The hand-labeled flag survives only on LABELED.
	 */
	public void setObservation(int marker, int cam, int frame, Point2D pos, MarkerStatus newStatus) {
		int i = this.index(marker, cam, frame);
		this.checkConsistent(pos, newStatus);
		this.write(i, pos, newStatus, newStatus == MarkerStatus.LABELED && this.handLabeled[i]);
	}

	// full tuple write, used to restore and to swap observations
	public void setObservation(int marker, int cam, int frame, Observation observation) {
		int i = this.index(marker, cam, frame);
		this.checkConsistent(observation.getPosition(), observation.getStatus());
		this.write(i, observation.getPosition(), observation.getStatus(), observation.isHandLabeled());
	}

	/**
	 * Moves an observation to a new position and re-derives its status against the initial
	 * position. Invisible observations are left untouched.
	 *
	 * @return false when the observation is invisible and nothing was written
	 */
	public boolean placeObservation(int marker, int cam, int frame, Point2D pos, boolean byHand) {
		int i = this.index(marker, cam, frame);
		if (this.status[i] == MarkerStatus.INVISIBLE.ordinal()) {
			return false;
		}
		if (pos == null) {
			this.write(i, null, MarkerStatus.UNLABELED, false);
			return true;
		}
		if (!pos.isFinite()) {
			throw new IllegalArgumentException("Position must be finite: " + pos);
		}
		MarkerStatus derived = this.deriveStatus(marker, cam, frame, pos, this.initialPosition(i));
		this.write(i, pos, derived, derived == MarkerStatus.LABELED && byHand);
		return true;
	}

	public void resetObservation(int marker, int cam, int frame) {
		int i = this.index(marker, cam, frame);
		this.write(i, null, MarkerStatus.UNLABELED, false);
		this.initX[i] = Double.NaN;
		this.initY[i] = Double.NaN;
	}

	// ----------------------------- eligibility ----------------------------- //

	public List<Integer> getEligibleCameras(int marker, int frame) {
		List<Integer> eligible = new ArrayList<Integer>();
		for (int cam = 0; cam < nCams; cam++) {
			if (this.getStatus(marker, cam, frame).isEligible()) {
				eligible.add(cam);
			}
		}
		return eligible;
	}

	public boolean isTriangulatable(int marker, int frame) {
		return this.getEligibleCameras(marker, frame).size() >= 2;
	}

	public boolean isFullyLabeled(int marker, int frame) {
		for (int cam = 0; cam < nCams; cam++) {
			if (this.getStatus(marker, cam, frame) != MarkerStatus.LABELED) {
				return false;
			}
		}
		return true;
	}

	// ----------------------------- invisibility ----------------------------- //

	public void markInvisible(int marker, int frame) {
		for (int cam = 0; cam < nCams; cam++) {
			this.write(this.index(marker, cam, frame), null, MarkerStatus.INVISIBLE, false);
		}
		this.clearPoint3D(marker, frame);
		LOGGER.fine("Marker " + marker + " marked invisible in frame " + frame);
	}

	public void clearInvisible(int marker, int frame) {
		for (int cam = 0; cam < nCams; cam++) {
			int i = this.index(marker, cam, frame);
			if (this.status[i] == MarkerStatus.INVISIBLE.ordinal()) {
				this.write(i, null, MarkerStatus.UNLABELED, false);
			}
		}
		LOGGER.fine("Marker " + marker + " cleared from invisible in frame " + frame);
	}

	public boolean isInvisible(int marker, int frame) {
		for (int cam = 0; cam < nCams; cam++) {
			if (this.getStatus(marker, cam, frame) != MarkerStatus.INVISIBLE) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return true if the marker is invisible after the toggle
	 */
	public boolean toggleInvisible(int marker, int frame) {
		if (this.isInvisible(marker, frame)) {
			this.clearInvisible(marker, frame);
			return false;
		}
		this.markInvisible(marker, frame);
		return true;
	}

	// ----------------------------- status derivation ----------------------------- //

	/**
	 * Status implied by a current and an initial position. Positions are compared after rounding
	 * so that floating point noise doesn't turn a loaded point into a labeled one. An invisible
	 * observation keeps its status.
	 */
	public MarkerStatus deriveStatus(int marker, int cam, int frame, Point2D currentPos, Point2D initialPos) {
		if (this.getStatus(marker, cam, frame) == MarkerStatus.INVISIBLE) {
			return MarkerStatus.INVISIBLE;
		}
		if (currentPos == null || !currentPos.isFinite()) {
			return MarkerStatus.UNLABELED;
		}
		if (initialPos == null || !initialPos.isFinite()) {
			return MarkerStatus.LABELED;
		}
		int decimals = Parameters.<Integer>get("statusRoundingDecimals");
		return Utils.roundedEquals(currentPos, initialPos, decimals) ? MarkerStatus.INITIALIZED : MarkerStatus.LABELED;
	}

	// re-derivation pass over one frame, skipping invisible observations
	public void checkStatus(int frame) {
		this.checkFrame(frame);
		for (int marker = 0; marker < nMarkers; marker++) {
			for (int cam = 0; cam < nCams; cam++) {
				int i = this.index(marker, cam, frame);
				if (this.status[i] == MarkerStatus.INVISIBLE.ordinal()) {
					continue;
				}
				MarkerStatus derived = this.deriveStatus(marker, cam, frame, this.position(i), this.initialPosition(i));
				this.status[i] = (byte) derived.ordinal();
				if (derived != MarkerStatus.LABELED) {
					this.handLabeled[i] = false;
				}
			}
		}
	}

	// ----------------------------- initial positions ----------------------------- //

	public Point2D getInitialPosition(int marker, int cam, int frame) {
		return this.initialPosition(this.index(marker, cam, frame));
	}

	public void setInitialPosition(int marker, int cam, int frame, Point2D pos) {
		int i = this.index(marker, cam, frame);
		this.initX[i] = pos == null ? Double.NaN : pos.getX();
		this.initY[i] = pos == null ? Double.NaN : pos.getY();
	}

	public void clearInitialPositions(int frame) {
		this.checkFrame(frame);
		int from = this.index(0, 0, frame);
		int to = from + nMarkers * nCams;
		Arrays.fill(this.initX, from, to, Double.NaN);
		Arrays.fill(this.initY, from, to, Double.NaN);
	}

	// ----------------------------- 3D points ----------------------------- //

	public Point3D getPoint3D(int marker, int frame) {
		int j = this.index3D(marker, frame);
		if (Double.isNaN(this.pointX[j])) {
			return null;
		}
		return new Point3D(this.pointX[j], this.pointY[j], this.pointZ[j]);
	}

	public void setPoint3D(int marker, int frame, Point3D point) {
		int j = this.index3D(marker, frame);
		if (point == null) {
			this.pointX[j] = Double.NaN;
			this.pointY[j] = Double.NaN;
			this.pointZ[j] = Double.NaN;
			return;
		}
		if (!point.isFinite()) {
			throw new IllegalArgumentException("3D point must be finite: " + point);
		}
		this.pointX[j] = point.getX();
		this.pointY[j] = point.getY();
		this.pointZ[j] = point.getZ();
	}

	public void clearPoint3D(int marker, int frame) {
		this.setPoint3D(marker, frame, null);
	}

	// ----------------------------- resets ----------------------------- //

	public void resetMarker(int marker, int frame) {
		for (int cam = 0; cam < nCams; cam++) {
			this.resetObservation(marker, cam, frame);
		}
		this.clearPoint3D(marker, frame);
	}

	public void resetFrame(int frame) {
		for (int marker = 0; marker < nMarkers; marker++) {
			this.resetMarker(marker, frame);
		}
	}

	/**
	 * Promotes every positioned observation of a frame to LABELED and forgets the initial
	 * positions, so later re-derivation keeps them labeled.
	 */
	public void acceptFrame(int frame) {
		this.checkFrame(frame);
		for (int marker = 0; marker < nMarkers; marker++) {
			for (int cam = 0; cam < nCams; cam++) {
				int i = this.index(marker, cam, frame);
				if (this.status[i] == MarkerStatus.INITIALIZED.ordinal()) {
					this.status[i] = (byte) MarkerStatus.LABELED.ordinal();
				}
			}
		}
		this.clearInitialPositions(frame);
	}

	// ----------------------------- snapshots ----------------------------- //

	public static class FrameSnapshot {
		private final int frame;
		private final double[] posX, posY, initX, initY;
		private final byte[] status;
		private final boolean[] handLabeled;
		private final double[] pointX, pointY, pointZ;

		private FrameSnapshot(int frame, double[] posX, double[] posY, double[] initX, double[] initY, byte[] status,
				boolean[] handLabeled, double[] pointX, double[] pointY, double[] pointZ) {
			this.frame = frame;
			this.posX = posX;
			this.posY = posY;
			this.initX = initX;
			this.initY = initY;
			this.status = status;
			this.handLabeled = handLabeled;
			this.pointX = pointX;
			this.pointY = pointY;
			this.pointZ = pointZ;
		}

		public int getFrame() {
			return frame;
		}
	}

	public FrameSnapshot snapshotFrame(int frame) {
		this.checkFrame(frame);
		int from = this.index(0, 0, frame);
		int to = from + nMarkers * nCams;
		int from3d = this.index3D(0, frame);
		int to3d = from3d + nMarkers;
		return new FrameSnapshot(frame, Arrays.copyOfRange(posX, from, to), Arrays.copyOfRange(posY, from, to),
				Arrays.copyOfRange(initX, from, to), Arrays.copyOfRange(initY, from, to),
				Arrays.copyOfRange(status, from, to), Arrays.copyOfRange(handLabeled, from, to),
				Arrays.copyOfRange(pointX, from3d, to3d), Arrays.copyOfRange(pointY, from3d, to3d),
				Arrays.copyOfRange(pointZ, from3d, to3d));
	}

	public void restoreFrame(FrameSnapshot snapshot) {
		int from = this.index(0, 0, snapshot.frame);
		int from3d = this.index3D(0, snapshot.frame);
		System.arraycopy(snapshot.posX, 0, posX, from, snapshot.posX.length);
		System.arraycopy(snapshot.posY, 0, posY, from, snapshot.posY.length);
		System.arraycopy(snapshot.initX, 0, initX, from, snapshot.initX.length);
		System.arraycopy(snapshot.initY, 0, initY, from, snapshot.initY.length);
		System.arraycopy(snapshot.status, 0, status, from, snapshot.status.length);
		System.arraycopy(snapshot.handLabeled, 0, handLabeled, from, snapshot.handLabeled.length);
		System.arraycopy(snapshot.pointX, 0, pointX, from3d, snapshot.pointX.length);
		System.arraycopy(snapshot.pointY, 0, pointY, from3d, snapshot.pointY.length);
		System.arraycopy(snapshot.pointZ, 0, pointZ, from3d, snapshot.pointZ.length);
	}

	// ----------------------------- dimensions ----------------------------- //

	public int getNumMarkers() {
		return nMarkers;
	}

	public int getNumCams() {
		return nCams;
	}

	public int getNumFrames() {
		return nFrames;
	}

	// ----------------------------- internals ----------------------------- //

	private void write(int i, Point2D pos, MarkerStatus newStatus, boolean byHand) {
		this.posX[i] = pos == null ? Double.NaN : pos.getX();
		this.posY[i] = pos == null ? Double.NaN : pos.getY();
		this.status[i] = (byte) newStatus.ordinal();
		this.handLabeled[i] = byHand;
	}

	private void checkConsistent(Point2D pos, MarkerStatus newStatus) {
		if (newStatus == null) {
			throw new IllegalArgumentException("Status must not be null");
		}
		if (pos != null && !pos.isFinite()) {
			throw new IllegalArgumentException("Position must be finite: " + pos);
		}
		if ((pos != null) != newStatus.hasPosition()) {
			throw new IllegalArgumentException(
					"Status " + newStatus + " is inconsistent with " + (pos == null ? "an absent" : "a present")
							+ " position");
		}
	}

	private Point2D position(int i) {
		if (Double.isNaN(this.posX[i])) {
			return null;
		}
		return new Point2D(this.posX[i], this.posY[i]);
	}

	private Point2D initialPosition(int i) {
		if (Double.isNaN(this.initX[i])) {
			return null;
		}
		return new Point2D(this.initX[i], this.initY[i]);
	}

	private int index(int marker, int cam, int frame) {
		this.checkMarker(marker);
		this.checkCam(cam);
		this.checkFrame(frame);
		return (frame * nMarkers + marker) * nCams + cam;
	}

	private int index3D(int marker, int frame) {
		this.checkMarker(marker);
		this.checkFrame(frame);
		return frame * nMarkers + marker;
	}

	private void checkMarker(int marker) {
		if (marker < 0 || marker >= nMarkers) {
			throw new IndexOutOfBoundsException("Marker " + marker + " outside [0, " + nMarkers + ")");
		}
	}

	private void checkCam(int cam) {
		if (cam < 0 || cam >= nCams) {
			throw new IndexOutOfBoundsException("Camera " + cam + " outside [0, " + nCams + ")");
		}
	}

	private void checkFrame(int frame) {
		if (frame < 0 || frame >= nFrames) {
			throw new IndexOutOfBoundsException("Frame " + frame + " outside [0, " + nFrames + ")");
		}
	}

	private static double[] nanArray(int n) {
		double[] a = new double[n];
		Arrays.fill(a, Double.NaN);
		return a;
	}

}
