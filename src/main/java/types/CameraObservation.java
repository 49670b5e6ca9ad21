package types;

// one camera's pixel for a marker, as fed to the triangulator
public class CameraObservation {

	private final int camera;
	private final Point2D pixel;

	public CameraObservation(int camera, Point2D pixel) {
		this.camera = camera;
		this.pixel = pixel;
	}

	public int getCamera() {
		return camera;
	}

	public Point2D getPixel() {
		return pixel;
	}

	public String toString() {
		return "CameraObservation { camera: " + camera + ", pixel: " + pixel + " }";
	}

}
