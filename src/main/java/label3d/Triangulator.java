package label3d;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import Jama.Matrix;
import Jama.SingularValueDecomposition;
import runtimevars.Parameters;
import types.CameraObservation;
import types.DegenerateGeometryException;
import types.InsufficientViewsException;
import types.Point2D;
import types.Point3D;

/**
 * Linear multi-view triangulation (DLT). Input pixels must already be undistorted.
 */
public class Triangulator {

	private static final Logger LOGGER = Logger.getLogger(Triangulator.class.getName());

	// extra copies of the held camera's equations in forceTriangulate. a fixed factor that lets the
	// held point dominate the fit, not a tunable weight.
	public static final int HELD_OBSERVATION_REPLICAS = 100;

	private final List<Camera> cameras;

	public Triangulator(List<Camera> cameras) {
		this.cameras = new ArrayList<Camera>(cameras);
	}

	public Point3D triangulate(int marker, int frame, List<CameraObservation> observations)
			throws InsufficientViewsException, DegenerateGeometryException {
		return this.solve(marker, frame, observations, -1);
	}

	/**
	 * Triangulation biased toward the observation the user is holding: the held camera's two
	 * equations are appended {@link #HELD_OBSERVATION_REPLICAS} more times before solving.
	 */
	public Point3D forceTriangulate(int marker, int frame, List<CameraObservation> observations, int heldCamera)
			throws InsufficientViewsException, DegenerateGeometryException {
		boolean found = false;
		for (CameraObservation o : observations) {
			found |= o.getCamera() == heldCamera;
		}
		if (!found) {
			throw new IllegalArgumentException("Held camera " + heldCamera + " has no observation");
		}
		return this.solve(marker, frame, observations, heldCamera);
	}

	// mean pixel distance between the observations and the undistorted projection of X
	public double reprojectionError(Point3D X, List<CameraObservation> observations) {
		double total = 0;
		for (CameraObservation o : observations) {
			Point2D projected = this.cameras.get(o.getCamera()).project(X, false);
			total += projected.distanceTo(o.getPixel());
		}
		return observations.isEmpty() ? 0 : total / observations.size();
	}

	private Point3D solve(int marker, int frame, List<CameraObservation> observations, int heldCamera)
			throws InsufficientViewsException, DegenerateGeometryException {

		if (observations.size() < 2) {
			throw new InsufficientViewsException(observations.size());
		}

		double epsilon = Parameters.<Double>get("degenerateEpsilon");

		List<Matrix> rows = new ArrayList<Matrix>();
		Matrix heldRows = null;
		for (CameraObservation o : observations) {
			if (!o.getPixel().isFinite()) {
				throw new DegenerateGeometryException("Camera " + o.getCamera() + " has a non-finite pixel");
			}
			Matrix pair = this.equations(o);
			rows.add(pair);
			if (o.getCamera() == heldCamera) {
				heldRows = pair;
			}
		}
		if (heldRows != null) {
			for (int i = 0; i < HELD_OBSERVATION_REPLICAS; i++) {
				rows.add(heldRows);
			}
		}

		// compute A matrix for AX = 0
		Matrix A = new Matrix(rows.size() * 2, 4);
		for (int i = 0; i < rows.size(); i++) {
			A.setMatrix(i * 2, i * 2 + 1, 0, 3, rows.get(i));
		}

		// Jama orders singular values descending, so the last column of V is the null space estimate
		SingularValueDecomposition svd = A.svd();
		Matrix X = svd.getV().getMatrix(0, 3, 3, 3);
		double w = X.get(3, 0);
		if (Math.abs(w) < epsilon || !Double.isFinite(w)) {
			throw new DegenerateGeometryException(
					"Marker " + marker + " frame " + frame + ": homogeneous coordinate " + w + " is at infinity");
		}
		X = X.times(1.0 / w);

		Point3D point = Point3D.fromMatrix(X);
		if (!point.isFinite()) {
			throw new DegenerateGeometryException("Marker " + marker + " frame " + frame + ": non-finite solution");
		}

		LOGGER.fine(String.format("Marker %d frame %d triangulated from %d views, reprojection error %.4f px", marker,
				frame, observations.size(), this.reprojectionError(point, observations)));

		return point;
	}

	// the two rows u*P3 - P1 and v*P3 - P2 contributed by one camera
	private Matrix equations(CameraObservation o) {
		if (o.getCamera() < 0 || o.getCamera() >= this.cameras.size()) {
			throw new IndexOutOfBoundsException("Camera " + o.getCamera() + " outside [0, " + this.cameras.size() + ")");
		}
		Matrix P = this.cameras.get(o.getCamera()).getProjectionMatrix();
		Matrix row0 = P.getMatrix(2, 2, 0, 3).times(o.getPixel().getX()).minus(P.getMatrix(0, 0, 0, 3));
		Matrix row1 = P.getMatrix(2, 2, 0, 3).times(o.getPixel().getY()).minus(P.getMatrix(1, 1, 0, 3));
		Matrix pair = new Matrix(2, 4);
		pair.setMatrix(0, 0, 0, 3, row0);
		pair.setMatrix(1, 1, 0, 3, row1);
		return pair;
	}

}
