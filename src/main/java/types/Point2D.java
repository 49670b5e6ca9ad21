package types;

import java.util.Objects;

// pixel or normalized image coordinate
public class Point2D {

	protected final double x;
	protected final double y;

	public Point2D(double x, double y) {
		this.x = x;
		this.y = y;
	}

	public Point2D(Point2D p) {
		this.x = p.x;
		this.y = p.y;
	}

	public double getX() {
		return x;
	}

	public double getY() {
		return y;
	}

	public boolean isFinite() {
		return Double.isFinite(x) && Double.isFinite(y);
	}

	public double distanceTo(Point2D p) {
		return Math.sqrt(Math.pow(this.x - p.x, 2) + Math.pow(this.y - p.y, 2));
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Point2D)) {
			return false;
		}
		Point2D p = (Point2D) o;
		return Double.compare(x, p.x) == 0 && Double.compare(y, p.y) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(x, y);
	}

	public String toString() {
		return String.format("Point2D { x: %f, y: %f }", this.x, this.y);
	}

}
