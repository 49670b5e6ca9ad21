package label3d;

import java.util.logging.Logger;

import Jama.Matrix;
import runtimevars.Parameters;
import toolbox.Utils;
import types.CameraCalibration;
import types.CameraCalibration.PoseConvention;
import types.InvalidCalibrationException;
import types.Point2D;
import types.Point3D;
import types.Pose;
import types.UndistortionDidNotConvergeException;

/**
 * Immutable pinhole camera with 3 radial and 2 tangential distortion terms.
 *
 * Built only through {@link #resolvePose(CameraCalibration)}, which is the one place where the
 * row/column pose conventions of calibration records are reconciled.
 */
public final class Camera {

	private static final Logger LOGGER = Logger.getLogger(Camera.class.getName());

	private final String name;
	private final Matrix K;
	private final double k1, k2, k3;
	private final double p1, p2;
	private final int imageHeight;
	private final int imageWidth;
	private final Pose pose;
	private final Matrix P;
	private final CameraCalibration source;

	private Camera(String name, Matrix K, double[] radial, double[] tangential, int imageHeight, int imageWidth,
			Pose pose, CameraCalibration source) {
		this.name = name;
		this.K = K;
		this.k1 = radial[0];
		this.k2 = radial[1];
		this.k3 = radial[2];
		this.p1 = tangential[0];
		this.p2 = tangential[1];
		this.imageHeight = imageHeight;
		this.imageWidth = imageWidth;
		this.pose = pose;
		this.P = K.times(pose.getExtrinsicMatrix());
		this.source = source;
	}

	public static Camera resolvePose(CameraCalibration raw) throws InvalidCalibrationException {

		double skewTolerance = Parameters.<Double>get("skewTolerance");
		double detTolerance = Parameters.<Double>get("rotationDeterminantTolerance");

		Matrix K = raw.getK();
		if (K == null || K.getRowDimension() != 3 || K.getColumnDimension() != 3) {
			throw new InvalidCalibrationException("Intrinsic matrix must be 3x3");
		}
		if (raw.getConvention() == PoseConvention.ROW_VECTOR) {
			K = K.transpose();
		}
		if (!Utils.isFinite(K)) {
			throw new InvalidCalibrationException("Intrinsic matrix has non-finite entries");
		}
		if (Math.abs(K.get(0, 1)) > skewTolerance) {
			throw new InvalidCalibrationException("Intrinsic matrix has nonzero skew: " + K.get(0, 1));
		}
		if (Math.abs(K.get(1, 0)) > skewTolerance || Math.abs(K.get(2, 0)) > skewTolerance
				|| Math.abs(K.get(2, 1)) > skewTolerance) {
			throw new InvalidCalibrationException("Intrinsic matrix is not upper triangular");
		}
		if (Math.abs(K.get(2, 2) - 1) > skewTolerance) {
			throw new InvalidCalibrationException("Intrinsic matrix K[2][2] must be 1, got " + K.get(2, 2));
		}
		if (K.get(0, 0) <= 0 || K.get(1, 1) <= 0) {
			throw new InvalidCalibrationException("Focal lengths must be positive");
		}

		double[] radial = raw.getRadialDistortion() == null ? new double[0] : raw.getRadialDistortion();
		if (radial.length < 2 || radial.length > 3) {
			throw new InvalidCalibrationException("Expected 2 or 3 radial distortion coefficients, got " + radial.length);
		}
		double[] tangential = raw.getTangentialDistortion() == null ? new double[0] : raw.getTangentialDistortion();
		if (tangential.length != 0 && tangential.length != 2) {
			throw new InvalidCalibrationException(
					"Expected 0 or 2 tangential distortion coefficients, got " + tangential.length);
		}

		Matrix R;
		Matrix rotation = raw.getRotation();
		if (rotation == null) {
			throw new InvalidCalibrationException("Missing rotation");
		}
		if (raw.isRodrigues()) {
			// a rotation vector decodes to the camera-from-world R in either convention, since the
			// row-form vector-to-matrix conversion already returns the transposed matrix r = R^T
			double[] r = rotation.getRowPackedCopy();
			R = Utils.rodriguesToMatrix(r[0], r[1], r[2]);
		} else if (rotation.getRowDimension() == 3 && rotation.getColumnDimension() == 3) {
			// row form stores the matrix as r = R^T
			R = raw.getConvention() == PoseConvention.ROW_VECTOR ? rotation.transpose() : rotation.copy();
		} else {
			throw new InvalidCalibrationException("Rotation must be a 3x3 matrix or a Rodrigues 3-vector");
		}
		if (!Utils.isFinite(R)) {
			throw new InvalidCalibrationException("Rotation has non-finite entries");
		}
		double det = R.det();
		if (Math.abs(det - 1) > detTolerance) {
			throw new InvalidCalibrationException("Rotation determinant must be +1, got " + det);
		}

		Matrix t = raw.getTranslation();
		if (t == null || t.getRowDimension() * t.getColumnDimension() != 3 || !Utils.isFinite(t)) {
			throw new InvalidCalibrationException("Translation must be a finite 3-vector");
		}

		Pose pose = new Pose(R, t);
		Camera camera = new Camera(raw.getName(), K.copy(), Utils.pad(radial, 3), Utils.pad(tangential, 2),
				raw.getImageHeight(), raw.getImageWidth(), pose, new CameraCalibration(raw));
		LOGGER.fine("Resolved camera '" + raw.getName() + "' at " + pose);
		return camera;
	}

	public Point2D project(Point3D world, boolean applyDistortion) {
		Point3D Xc = this.pose.transformPoint(world);
		Point2D normalized = new Point2D(Xc.getX() / Xc.getZ(), Xc.getY() / Xc.getZ());
		if (applyDistortion) {
			normalized = this.distortNormalized(normalized);
		}
		return this.toPixel(normalized);
	}

	public Point2D distort(Point2D undistortedPixel) {
		return this.toPixel(this.distortNormalized(this.toNormalized(undistortedPixel)));
	}

	/**
	 * Inverts the distortion model by fixed-point iteration on normalized coordinates. Converged
	 * when re-distorting the estimate lands within the configured pixel tolerance of the input.
	 */
	public Point2D undistort(Point2D distortedPixel) throws UndistortionDidNotConvergeException {

		int maxIterations = Parameters.<Integer>get("undistortMaxIterations");
		double tolerance = Parameters.<Double>get("undistortTolerance");

		if (!this.hasDistortion()) {
			return new Point2D(distortedPixel);
		}

		Point2D target = this.toNormalized(distortedPixel);
		double x = target.getX();
		double y = target.getY();
		double residual = Double.POSITIVE_INFINITY;

		for (int i = 0; i < maxIterations; i++) {
			double r2 = x * x + y * y;
			double radial = 1 + k1 * r2 + k2 * r2 * r2 + k3 * r2 * r2 * r2;
			double dx = 2 * p1 * x * y + p2 * (r2 + 2 * x * x);
			double dy = p1 * (r2 + 2 * y * y) + 2 * p2 * x * y;
			x = (target.getX() - dx) / radial;
			y = (target.getY() - dy) / radial;

			Point2D estimate = new Point2D(x, y);
			residual = this.toPixel(this.distortNormalized(estimate)).distanceTo(distortedPixel);
			if (!Double.isFinite(residual)) {
				break;
			}
			if (residual < tolerance) {
				return this.toPixel(estimate);
			}
		}

		throw new UndistortionDidNotConvergeException(distortedPixel, maxIterations, residual);
	}

	public Pose worldPose() {
		return new Pose(this.pose);
	}

	// 3x4 projection matrix K[R|t]
	public Matrix getProjectionMatrix() {
		return this.P.copy();
	}

	public boolean hasDistortion() {
		return k1 != 0 || k2 != 0 || k3 != 0 || p1 != 0 || p2 != 0;
	}

	// raw record this camera was resolved from, used when saving sessions
	public CameraCalibration getCalibration() {
		return new CameraCalibration(this.source);
	}

	public String getName() {
		return name;
	}

	public Matrix getK() {
		return K.copy();
	}

	public double[] getRadialDistortion() {
		return new double[] { k1, k2, k3 };
	}

	public double[] getTangentialDistortion() {
		return new double[] { p1, p2 };
	}

	public int getImageHeight() {
		return imageHeight;
	}

	public int getImageWidth() {
		return imageWidth;
	}

	private Point2D distortNormalized(Point2D n) {
		double x = n.getX();
		double y = n.getY();
		double r2 = x * x + y * y;
		double radial = 1 + k1 * r2 + k2 * r2 * r2 + k3 * r2 * r2 * r2;
		double xd = x * radial + 2 * p1 * x * y + p2 * (r2 + 2 * x * x);
		double yd = y * radial + p1 * (r2 + 2 * y * y) + 2 * p2 * x * y;
		return new Point2D(xd, yd);
	}

	// zero skew is enforced at construction
	private Point2D toPixel(Point2D n) {
		return new Point2D(K.get(0, 0) * n.getX() + K.get(0, 2), K.get(1, 1) * n.getY() + K.get(1, 2));
	}

	private Point2D toNormalized(Point2D pixel) {
		return new Point2D((pixel.getX() - K.get(0, 2)) / K.get(0, 0), (pixel.getY() - K.get(1, 2)) / K.get(1, 1));
	}

}
