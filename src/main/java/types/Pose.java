package types;

import org.ejml.data.DMatrixRMaj;

import Jama.Matrix;
import georegression.geometry.ConvertRotation3D_F64;
import georegression.struct.so.Quaternion_F64;

// camera-from-world transformation in the column-vector convention: x_cam = R * x_world + t.
// the camera center and the world-from-camera rotation are derived, never stored, so the two
// directions can't drift apart.
public class Pose {

	protected Matrix R = Matrix.identity(3, 3);
	protected Matrix t = new Matrix(3, 1);

	public Pose() {

	}

	public Pose(Matrix R, Matrix t) {
		if (R.getRowDimension() != 3 || R.getColumnDimension() != 3) {
			throw new IllegalArgumentException("rotation must be 3x3");
		}
		if (t.getRowDimension() * t.getColumnDimension() != 3) {
			throw new IllegalArgumentException("translation must have 3 elements");
		}
		this.R = R.copy();
		this.t = new Matrix(3, 1);
		for (int i = 0; i < 3; i++) {
			this.t.set(i, 0, t.getColumnDimension() == 1 ? t.get(i, 0) : t.get(0, i));
		}
	}

	public Pose(Pose pose) {
		this.setPose(pose);
	}

	public void setPose(Pose pose) {
		this.R = pose.R.copy();
		this.t = pose.t.copy();
	}

	// world point -> camera coordinates
	public Point3D transformPoint(Point3D p) {
		Matrix Xc = this.R.times(p.getMatrix()).plus(this.t);
		return Point3D.fromMatrix(Xc);
	}

	/**
	 * 4x4 homogeneous matrix [R t; 0 1] mapping world points into the camera frame.
	 */
	public Matrix getHomogeneousMatrix() {
		Matrix Rt = Matrix.identity(4, 4);
		Rt.setMatrix(0, 2, 0, 2, this.R);
		Rt.setMatrix(0, 2, 3, 3, this.t);
		return Rt;
	}

	// 3x4 extrinsic matrix [R|t]
	public Matrix getExtrinsicMatrix() {
		return this.getHomogeneousMatrix().getMatrix(0, 2, 0, 3);
	}

	public Matrix getRotationMatrix() {
		return this.R.copy();
	}

	public Matrix getTranslation() {
		return this.t.copy();
	}

	/**
	 * Rotation taking camera axes into the world frame, Rw = R^T.
	 */
	public Matrix getWorldRotation() {
		return this.R.transpose();
	}

	/**
	 * Camera center in world coordinates, C = -R^T t (the row-vector form -t * R).
	 */
	public Point3D getCenter() {
		return Point3D.fromMatrix(this.R.transpose().times(this.t).times(-1));
	}

	public double getCx() {
		return this.getCenter().getX();
	}

	public double getCy() {
		return this.getCenter().getY();
	}

	public double getCz() {
		return this.getCenter().getZ();
	}

	public double getDeterminant() {
		return this.R.det();
	}

	public double getDistanceFrom(Pose pose) {
		return this.getCenter().distanceTo(pose.getCenter());
	}

	// unit quaternion (qw, qx, qy, qz) of the world-from-camera rotation
	public Matrix getQuaternion() {
		DMatrixRMaj Rw = new DMatrixRMaj(3, 3);
		for (int i = 0; i < 3; i++) {
			for (int j = 0; j < 3; j++) {
				Rw.set(i, j, this.R.get(j, i));
			}
		}
		Quaternion_F64 quat = ConvertRotation3D_F64.matrixToQuaternion(Rw, null);
		quat.normalize();
		Matrix q = new Matrix(4, 1);
		q.set(0, 0, quat.w);
		q.set(1, 0, quat.x);
		q.set(2, 0, quat.y);
		q.set(3, 0, quat.z);
		return q;
	}

	public String toString() {
		Matrix q = this.getQuaternion();
		return String.format("Pose { qw: %f, qx: %f, qy: %f, qz: %f, Cx: %f, Cy: %f, Cz: %f }", q.get(0, 0),
				q.get(1, 0), q.get(2, 0), q.get(3, 0), this.getCx(), this.getCy(), this.getCz());
	}

}
