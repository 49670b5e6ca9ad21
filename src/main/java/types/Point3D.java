package types;

import Jama.Matrix;

public class Point3D {

	protected final double x;
	protected final double y;
	protected final double z;

	public Point3D(double x, double y, double z) {
		this.x = x;
		this.y = y;
		this.z = z;
	}

	public static Point3D fromMatrix(Matrix X) {
		return new Point3D(X.get(0, 0), X.get(1, 0), X.get(2, 0));
	}

	public double getX() {
		return x;
	}

	public double getY() {
		return y;
	}

	public double getZ() {
		return z;
	}

	public boolean isFinite() {
		return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
	}

	public double distanceTo(Point3D p) {
		return Math.sqrt(Math.pow(this.x - p.x, 2) + Math.pow(this.y - p.y, 2) + Math.pow(this.z - p.z, 2));
	}

	public Matrix getMatrix() {
		Matrix X = new Matrix(3, 1);
		X.set(0, 0, this.x);
		X.set(1, 0, this.y);
		X.set(2, 0, this.z);
		return X;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Point3D)) {
			return false;
		}
		Point3D p = (Point3D) o;
		return Double.compare(x, p.x) == 0 && Double.compare(y, p.y) == 0 && Double.compare(z, p.z) == 0;
	}

	@Override
	public int hashCode() {
		return java.util.Objects.hash(x, y, z);
	}

	public String toString() {
		return String.format("Point3D { x: %f, y: %f, z: %f }", this.x, this.y, this.z);
	}

}
