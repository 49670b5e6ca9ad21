package label3d;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import mock.MockRig;
import runtimevars.Parameters;
import types.CameraCalibration;
import types.MarkerStatus;
import types.Point2D;
import types.Point3D;

public class ReprojectorTest {

	private List<Camera> cameras;
	private CorrespondenceStore store;
	private Reprojector reprojector;

	@BeforeEach
	public void setUp() throws Exception {
		this.cameras = new ArrayList<Camera>();
		MockRig rig = new MockRig(3, 2.0, 1.0).withDistortion(new double[] { -0.1, 0.01, 0 },
				new double[] { 0, 0 });
		for (CameraCalibration c : rig.getCalibrations()) {
			this.cameras.add(Camera.resolvePose(c));
		}
		this.store = new CorrespondenceStore(1, 3, 1);
		this.reprojector = new Reprojector(this.store, this.cameras);
	}

	@AfterEach
	public void resetParameters() {
		Parameters.setDefaultParameters();
	}

	@Test
	public void writesEveryVisibleView() {
		Point3D X = new Point3D(0.1, 0, 0.05);
		this.store.setPoint3D(0, 0, X);
		this.store.setObservation(0, 1, 0, null, MarkerStatus.INVISIBLE);

		assertEquals(2, this.reprojector.reprojectAll(0, 0));

		for (int cam : new int[] { 0, 2 }) {
			Point2D expected = this.cameras.get(cam).project(X, true);
			assertEquals(expected, this.store.getPosition(0, cam, 0));
			assertEquals(MarkerStatus.LABELED, this.store.getStatus(0, cam, 0));
			assertFalse(this.store.isHandLabeled(0, cam, 0));
		}
		assertNull(this.store.getPosition(0, 1, 0));
		assertEquals(MarkerStatus.INVISIBLE, this.store.getStatus(0, 1, 0));
	}

	@Test
	public void skipsDistortionForUndistortedImages() {
		Parameters.put("undistortedImages", true);
		Point3D X = new Point3D(-0.1, 0.1, 0);
		this.store.setPoint3D(0, 0, X);
		this.reprojector.reprojectAll(0, 0);
		assertEquals(this.cameras.get(0).project(X, false), this.store.getPosition(0, 0, 0));
	}

	@Test
	public void absentPointIsANoOp() {
		assertEquals(0, this.reprojector.reprojectAll(0, 0));
		for (int cam = 0; cam < 3; cam++) {
			assertEquals(MarkerStatus.UNLABELED, this.store.getStatus(0, cam, 0));
		}
	}

}
