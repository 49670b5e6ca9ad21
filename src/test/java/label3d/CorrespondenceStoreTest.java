package label3d;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import types.MarkerStatus;
import types.Observation;
import types.Point2D;
import types.Point3D;

public class CorrespondenceStoreTest {

	private CorrespondenceStore store;

	@BeforeEach
	public void setUp() {
		this.store = new CorrespondenceStore(4, 3, 2);
	}

	@Test
	public void startsUnlabeled() {
		for (int m = 0; m < 4; m++) {
			for (int c = 0; c < 3; c++) {
				for (int f = 0; f < 2; f++) {
					assertEquals(Observation.EMPTY, this.store.getObservation(m, c, f));
				}
			}
			assertNull(this.store.getPoint3D(m, 0));
		}
	}

	@Test
	public void rejectsPositionStatusMismatch() {
		assertThrows(IllegalArgumentException.class,
				() -> this.store.setObservation(0, 0, 0, new Point2D(1, 2), MarkerStatus.UNLABELED));
		assertThrows(IllegalArgumentException.class,
				() -> this.store.setObservation(0, 0, 0, new Point2D(1, 2), MarkerStatus.INVISIBLE));
		assertThrows(IllegalArgumentException.class,
				() -> this.store.setObservation(0, 0, 0, null, MarkerStatus.LABELED));
		assertThrows(IllegalArgumentException.class,
				() -> this.store.setObservation(0, 0, 0, new Point2D(Double.NaN, 2), MarkerStatus.LABELED));
		assertEquals(Observation.EMPTY, this.store.getObservation(0, 0, 0));
	}

	@Test
	public void validatesIndices() {
		assertThrows(IndexOutOfBoundsException.class, () -> this.store.getStatus(4, 0, 0));
		assertThrows(IndexOutOfBoundsException.class, () -> this.store.getStatus(0, 3, 0));
		assertThrows(IndexOutOfBoundsException.class, () -> this.store.getStatus(0, 0, -1));
		assertThrows(IndexOutOfBoundsException.class, () -> this.store.getPoint3D(0, 2));
	}

	@Test
	public void handPlacementWithoutInitialIsLabeled() {
		assertTrue(this.store.placeObservation(1, 2, 1, new Point2D(100, 50), true));
		Observation o = this.store.getObservation(1, 2, 1);
		assertEquals(MarkerStatus.LABELED, o.getStatus());
		assertTrue(o.isHandLabeled());
		assertEquals(new Point2D(100, 50), o.getPosition());
	}

	@Test
	public void deriveStatusComparesRoundedPositions() {
		Point2D initial = new Point2D(10.0001, 20);
		assertEquals(MarkerStatus.UNLABELED, this.store.deriveStatus(0, 0, 0, null, initial));
		assertEquals(MarkerStatus.LABELED, this.store.deriveStatus(0, 0, 0, new Point2D(10, 20), null));
		assertEquals(MarkerStatus.INITIALIZED, this.store.deriveStatus(0, 0, 0, new Point2D(10.00049, 20), initial));
		assertEquals(MarkerStatus.LABELED, this.store.deriveStatus(0, 0, 0, new Point2D(10.002, 20), initial));
	}

	@Test
	public void deriveStatusLeavesInvisibleAlone() {
		this.store.setObservation(0, 0, 0, null, MarkerStatus.INVISIBLE);
		assertEquals(MarkerStatus.INVISIBLE, this.store.deriveStatus(0, 0, 0, new Point2D(1, 1), null));
	}

	@Test
	public void movingAnInitializedPointLabelsIt() {
		Point2D loaded = new Point2D(300, 200);
		this.store.setInitialPosition(0, 1, 0, loaded);
		this.store.setObservation(0, 1, 0, loaded, MarkerStatus.INITIALIZED);

		this.store.placeObservation(0, 1, 0, new Point2D(300.0002, 200), false);
		assertEquals(MarkerStatus.INITIALIZED, this.store.getStatus(0, 1, 0));

		this.store.placeObservation(0, 1, 0, new Point2D(305, 200), true);
		assertEquals(MarkerStatus.LABELED, this.store.getStatus(0, 1, 0));
		assertTrue(this.store.isHandLabeled(0, 1, 0));
	}

	@Test
	public void eligibleCamerasAreInitializedOrLabeled() {
		this.store.placeObservation(2, 0, 0, new Point2D(1, 1), true);
		this.store.setInitialPosition(2, 1, 0, new Point2D(2, 2));
		this.store.setObservation(2, 1, 0, new Point2D(2, 2), MarkerStatus.INITIALIZED);
		this.store.setObservation(2, 2, 0, null, MarkerStatus.INVISIBLE);

		assertEquals(Arrays.asList(0, 1), this.store.getEligibleCameras(2, 0));
		assertTrue(this.store.isTriangulatable(2, 0));
		assertFalse(this.store.isTriangulatable(2, 1));
	}

	@Test
	public void invisibleClearsEveryViewAndReturnsToUnlabeled() {
		for (int c = 0; c < 3; c++) {
			this.store.placeObservation(0, c, 1, new Point2D(10 * c, 5), true);
		}
		this.store.setPoint3D(0, 1, new Point3D(1, 2, 3));

		this.store.markInvisible(0, 1);
		for (int c = 0; c < 3; c++) {
			assertEquals(MarkerStatus.INVISIBLE, this.store.getStatus(0, c, 1));
			assertNull(this.store.getPosition(0, c, 1));
			assertFalse(this.store.isHandLabeled(0, c, 1));
		}
		assertEquals(Collections.emptyList(), this.store.getEligibleCameras(0, 1));
		assertNull(this.store.getPoint3D(0, 1));
		assertFalse(this.store.placeObservation(0, 2, 1, new Point2D(1, 1), true));

		this.store.clearInvisible(0, 1);
		for (int c = 0; c < 3; c++) {
			assertEquals(Observation.EMPTY, this.store.getObservation(0, c, 1));
		}
	}

	@Test
	public void toggleInvisibleFlipsBetweenStates() {
		this.store.placeObservation(3, 0, 0, new Point2D(1, 1), true);
		assertTrue(this.store.toggleInvisible(3, 0));
		assertTrue(this.store.isInvisible(3, 0));
		assertFalse(this.store.toggleInvisible(3, 0));
		assertEquals(MarkerStatus.UNLABELED, this.store.getStatus(3, 0, 0));
	}

	@Test
	public void checkStatusSkipsInvisible() {
		this.store.setInitialPosition(1, 0, 0, new Point2D(4, 4));
		this.store.setObservation(1, 0, 0, new Point2D(9, 9), MarkerStatus.INITIALIZED);
		this.store.setObservation(1, 1, 0, null, MarkerStatus.INVISIBLE);

		this.store.checkStatus(0);
		assertEquals(MarkerStatus.LABELED, this.store.getStatus(1, 0, 0));
		assertEquals(MarkerStatus.INVISIBLE, this.store.getStatus(1, 1, 0));
	}

	@Test
	public void acceptFrameLabelsLoadedPoints() {
		Point2D loaded = new Point2D(50, 60);
		this.store.setInitialPosition(0, 0, 1, loaded);
		this.store.setObservation(0, 0, 1, loaded, MarkerStatus.INITIALIZED);

		this.store.acceptFrame(1);
		assertEquals(MarkerStatus.LABELED, this.store.getStatus(0, 0, 1));
		assertNull(this.store.getInitialPosition(0, 0, 1));

		this.store.checkStatus(1);
		assertEquals(MarkerStatus.LABELED, this.store.getStatus(0, 0, 1));
	}

	@Test
	public void resetsClearMarkerAndFrame() {
		this.store.placeObservation(0, 0, 0, new Point2D(1, 1), true);
		this.store.placeObservation(1, 1, 0, new Point2D(2, 2), true);
		this.store.placeObservation(1, 1, 1, new Point2D(3, 3), true);
		this.store.setPoint3D(1, 0, new Point3D(0, 0, 1));

		this.store.resetMarker(0, 0);
		assertEquals(Observation.EMPTY, this.store.getObservation(0, 0, 0));
		assertEquals(MarkerStatus.LABELED, this.store.getStatus(1, 1, 0));

		this.store.resetFrame(0);
		assertEquals(Observation.EMPTY, this.store.getObservation(1, 1, 0));
		assertNull(this.store.getPoint3D(1, 0));
		assertEquals(MarkerStatus.LABELED, this.store.getStatus(1, 1, 1));
	}

	@Test
	public void snapshotRestoresFrame() {
		this.store.placeObservation(2, 1, 1, new Point2D(7, 8), true);
		this.store.setPoint3D(2, 1, new Point3D(1, 1, 1));
		CorrespondenceStore.FrameSnapshot snapshot = this.store.snapshotFrame(1);

		this.store.resetFrame(1);
		this.store.placeObservation(0, 0, 1, new Point2D(1, 1), true);
		this.store.restoreFrame(snapshot);

		assertEquals(new Observation(new Point2D(7, 8), MarkerStatus.LABELED, true), this.store.getObservation(2, 1, 1));
		assertEquals(Observation.EMPTY, this.store.getObservation(0, 0, 1));
		assertEquals(new Point3D(1, 1, 1), this.store.getPoint3D(2, 1));
	}

	@Test
	public void fullyLabeledNeedsEveryView() {
		this.store.placeObservation(0, 0, 0, new Point2D(1, 1), true);
		this.store.placeObservation(0, 1, 0, new Point2D(1, 1), true);
		assertFalse(this.store.isFullyLabeled(0, 0));
		this.store.placeObservation(0, 2, 0, new Point2D(1, 1), false);
		assertTrue(this.store.isFullyLabeled(0, 0));
	}

}
