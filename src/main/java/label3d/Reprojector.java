package label3d;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import runtimevars.Parameters;
import types.MarkerStatus;
import types.Point2D;
import types.Point3D;

public class Reprojector {

	private static final Logger LOGGER = Logger.getLogger(Reprojector.class.getName());

	private final CorrespondenceStore store;
	private final List<Camera> cameras;

	public Reprojector(CorrespondenceStore store, List<Camera> cameras) {
		this.store = store;
		this.cameras = new ArrayList<Camera>(cameras);
	}

	public Point2D reproject(Point3D point, Camera camera, boolean applyDistortion) {
		return camera.project(point, applyDistortion);
	}

	/**
	 * Writes the projection of the marker's current 3D point into every camera that isn't
	 * invisible. Callers that triangulated from raw clicks restore those clicks afterwards.
	 *
	 * @return number of cameras written
	 */
	public int reprojectAll(int marker, int frame) {
		Point3D point = this.store.getPoint3D(marker, frame);
		if (point == null) {
			return 0;
		}
		boolean applyDistortion = !Parameters.<Boolean>get("undistortedImages");
		int written = 0;
		for (int cam = 0; cam < this.cameras.size(); cam++) {
			if (this.store.getStatus(marker, cam, frame) == MarkerStatus.INVISIBLE) {
				continue;
			}
			Point2D pixel = this.reproject(point, this.cameras.get(cam), applyDistortion);
			if (!pixel.isFinite()) {
				LOGGER.warning("Marker " + marker + " frame " + frame + " projects to a non-finite pixel in camera " + cam);
				continue;
			}
			this.store.placeObservation(marker, cam, frame, pixel, false);
			written++;
		}
		return written;
	}

}
