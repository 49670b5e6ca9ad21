package types;

public class UndistortionDidNotConvergeException extends Exception {

	private static final long serialVersionUID = 1L;

	private final Point2D distortedPixel;

	public UndistortionDidNotConvergeException(Point2D distortedPixel, int iterations, double residual) {
		super(String.format("Undistortion of (%f, %f) did not converge after %d iterations (residual %e px)",
				distortedPixel.getX(), distortedPixel.getY(), iterations, residual));
		this.distortedPixel = distortedPixel;
	}

	public Point2D getDistortedPixel() {
		return distortedPixel;
	}

}
