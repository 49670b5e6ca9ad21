package label3d;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import buffers.QueuedBuffer;
import mock.MockRig;
import types.AnnotationEvent;
import types.AnnotationEvent.Kind;
import types.MarkerStatus;
import types.Point2D;
import types.Point3D;

public class AnnotationControllerTest {

	private LabelingSession session;
	private QueuedBuffer<AnnotationEvent> events;
	private AnnotationController controller;

	@BeforeEach
	public void setUp() throws Exception {
		this.session = LabelingSession.fromCalibrations(new MockRig(3, 2.0, 1.0).getCalibrations(),
				MockRig.chainSkeleton(2, 2), 2, new int[] { 0, 1, 2 });
		this.events = new QueuedBuffer<AnnotationEvent>();
		this.controller = new AnnotationController(this.session, this.events);
	}

	@Test
	public void markerSelectionWraps() {
		this.events.push(new AnnotationEvent(Kind.PREVIOUS_MARKER));
		this.controller.processPending();
		assertEquals(3, this.controller.getSelectedMarker());

		this.events.push(new AnnotationEvent(Kind.NEXT_MARKER));
		this.events.push(new AnnotationEvent(Kind.NEXT_MARKER));
		this.controller.processPending();
		assertEquals(1, this.controller.getSelectedMarker());

		this.events.push(AnnotationEvent.selectMarker(6));
		this.controller.processPending();
		assertEquals(2, this.controller.getSelectedMarker());
	}

	@Test
	public void clicksGoToSelectedMarkerAndFrame() {
		this.events.push(AnnotationEvent.setFrame(2));
		this.events.push(AnnotationEvent.selectMarker(1));
		this.events.push(AnnotationEvent.click(0, new Point2D(320, 240)));
		assertEquals(0, this.controller.processPending());

		assertEquals(new Point2D(320, 240), this.session.getStore().getPosition(1, 0, 2));
		assertTrue(this.session.getStore().isHandLabeled(1, 0, 2));
		assertNull(this.session.getStore().getPosition(1, 0, 0));
	}

	@Test
	public void triangulateUsesHeldView() {
		Point3D X = new Point3D(0.02, 0.01, -0.02);
		Point2D held = this.session.getCameras().get(1).project(X, true);
		held = new Point2D(held.getX() - 5, held.getY() + 2);

		this.events.push(AnnotationEvent.click(0, this.session.getCameras().get(0).project(X, true)));
		this.events.push(AnnotationEvent.click(2, this.session.getCameras().get(2).project(X, true)));
		this.events.push(AnnotationEvent.hold(1, held));
		this.events.push(new AnnotationEvent(Kind.TRIANGULATE));
		this.controller.processPending();

		assertEquals(1, this.controller.getHeldCamera());
		Point3D estimate = this.session.getStore().getPoint3D(0, 0);
		assertNotNull(estimate);
		assertTrue(this.session.getCameras().get(1).project(estimate, true).distanceTo(held) < 1.0);

		this.events.push(new AnnotationEvent(Kind.RELEASE));
		this.controller.processPending();
		assertEquals(-1, this.controller.getHeldCamera());
	}

	@Test
	public void changingFrameDropsHeldView() {
		this.events.push(AnnotationEvent.hold(1, new Point2D(10, 10)));
		this.events.push(AnnotationEvent.setFrame(1));
		this.controller.processPending();
		assertEquals(-1, this.controller.getHeldCamera());
		assertEquals(1, this.controller.getCurrentFrame());
	}

	@Test
	public void changingMarkerDropsHeldView() {
		this.events.push(AnnotationEvent.hold(1, new Point2D(10, 10)));
		this.events.push(new AnnotationEvent(Kind.NEXT_MARKER));
		this.controller.processPending();
		assertEquals(-1, this.controller.getHeldCamera());

		this.events.push(AnnotationEvent.hold(0, new Point2D(20, 20)));
		this.events.push(AnnotationEvent.selectMarker(3));
		this.controller.processPending();
		assertEquals(-1, this.controller.getHeldCamera());

		this.events.push(AnnotationEvent.hold(2, new Point2D(30, 30)));
		this.events.push(new AnnotationEvent(Kind.PREVIOUS_MARKER));
		this.controller.processPending();
		assertEquals(-1, this.controller.getHeldCamera());

		// every marker has a single view, so the frame-wide solve writes nothing
		this.events.push(new AnnotationEvent(Kind.NEXT_MARKER));
		this.events.push(new AnnotationEvent(Kind.TRIANGULATE));
		assertEquals(0, this.controller.processPending());
		assertNull(this.session.getStore().getPoint3D(1, 0));
	}

	@Test
	public void invalidEventsAreRejectedAndTheRestApplied() {
		this.events.push(AnnotationEvent.setFrame(3));
		this.events.push(AnnotationEvent.click(5, new Point2D(1, 1)));
		this.events.push(AnnotationEvent.click(2, new Point2D(7, 8)));
		assertEquals(2, this.controller.processPending());

		assertEquals(0, this.controller.getCurrentFrame());
		assertEquals(new Point2D(7, 8), this.session.getStore().getPosition(0, 2, 0));
		assertTrue(this.events.isEmpty());
	}

	@Test
	public void frameLevelActions() {
		this.events.push(AnnotationEvent.click(0, new Point2D(100, 100)));
		this.events.push(AnnotationEvent.click(1, new Point2D(200, 200)));
		this.events.push(AnnotationEvent.deleteMarker(1));
		this.controller.processPending();
		assertEquals(MarkerStatus.UNLABELED, this.session.getStore().getStatus(0, 1, 0));
		assertEquals(MarkerStatus.LABELED, this.session.getStore().getStatus(0, 0, 0));

		this.events.push(new AnnotationEvent(Kind.TOGGLE_INVISIBLE));
		this.controller.processPending();
		assertTrue(this.session.getStore().isInvisible(0, 0));

		this.events.push(new AnnotationEvent(Kind.RESET_FRAME));
		this.controller.processPending();
		for (int cam = 0; cam < 3; cam++) {
			assertEquals(MarkerStatus.UNLABELED, this.session.getStore().getStatus(0, cam, 0));
		}
	}

	@Test
	public void swapEventExchangesAnimalsInTheView() {
		this.events.push(AnnotationEvent.click(2, new Point2D(50, 60)));
		this.events.push(AnnotationEvent.swapIdentities(2));
		this.controller.processPending();

		assertNull(this.session.getStore().getPosition(0, 2, 0));
		assertEquals(new Point2D(50, 60), this.session.getStore().getPosition(2, 2, 0));
	}

	@Test
	public void saveRunsCallbacks() {
		List<LabelingSession> saved = new ArrayList<LabelingSession>();
		this.controller.whenSaveRequested(s -> saved.add(s));
		this.events.push(new AnnotationEvent(Kind.SAVE));
		this.controller.processPending();
		assertEquals(1, saved.size());
		assertSame(this.session, saved.get(0));
	}

}
