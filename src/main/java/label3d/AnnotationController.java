package label3d;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import buffers.Buffer;
import types.AnnotationEvent;
import types.Callback;

/**
 * Applies queued user actions to a session. Keeps the interaction state a UI would otherwise
 * hold: the selected marker, the current frame and the view whose node is being dragged.
 */
public class AnnotationController {

	private static final Logger LOGGER = Logger.getLogger(AnnotationController.class.getName());

	protected LabelingSession session;
	protected Buffer<AnnotationEvent> events;
	protected List<Callback<LabelingSession>> saveCallbacks = new ArrayList<Callback<LabelingSession>>();

	protected int selectedMarker = 0;
	protected int currentFrame = 0;
	protected int heldCamera = -1;

	public AnnotationController(LabelingSession session, Buffer<AnnotationEvent> events) {
		this.session = session;
		this.events = events;
	}

	public void whenSaveRequested(Callback<LabelingSession> cb) {
		this.saveCallbacks.add(cb);
	}

	/**
	 * Drains the event buffer. An event that names an invalid marker, view, frame or range is
	 * rejected and logged, and the remaining events are still applied.
	 *
	 * @return number of rejected events
	 */
	public int processPending() {
		int rejected = 0;
		AnnotationEvent event;
		while ((event = this.events.getNext()) != null) {
			try {
				this.handle(event);
			} catch (IllegalArgumentException | IndexOutOfBoundsException e) {
				LOGGER.log(Level.WARNING, "Rejected " + event, e);
				rejected++;
			}
		}
		return rejected;
	}

	protected void handle(AnnotationEvent event) {

		int nMarkers = this.session.getNumMarkers();

		switch (event.getKind()) {
		case SELECT_MARKER:
			this.selectedMarker = Math.floorMod(event.getMarker(), nMarkers);
			this.heldCamera = -1;
			break;
		case NEXT_MARKER:
			this.selectedMarker = Math.floorMod(this.selectedMarker + 1, nMarkers);
			this.heldCamera = -1;
			break;
		case PREVIOUS_MARKER:
			this.selectedMarker = Math.floorMod(this.selectedMarker - 1, nMarkers);
			this.heldCamera = -1;
			break;
		case SET_FRAME:
			if (event.getFrame() < 0 || event.getFrame() >= this.session.getNumFrames()) {
				throw new IndexOutOfBoundsException(
						"Frame " + event.getFrame() + " outside [0, " + this.session.getNumFrames() + ")");
			}
			this.currentFrame = event.getFrame();
			this.heldCamera = -1;
			break;
		case CLICK:
			this.session.clickImage(this.selectedMarker, event.getCamera(), this.currentFrame, event.getPosition());
			break;
		case HOLD:
			if (this.session.clickImage(this.selectedMarker, event.getCamera(), this.currentFrame,
					event.getPosition())) {
				this.heldCamera = event.getCamera();
			}
			break;
		case RELEASE:
			this.heldCamera = -1;
			break;
		case TRIANGULATE:
			if (this.heldCamera >= 0) {
				this.session.triangulateHeld(this.heldCamera, this.selectedMarker, this.currentFrame);
			} else {
				this.session.triangulateFrame(this.currentFrame);
			}
			break;
		case SWAP_IDENTITIES:
			this.session.swapAnimalIdentities(event.getCamera(), this.currentFrame);
			break;
		case TOGGLE_INVISIBLE:
			this.session.toggleInvisible(this.selectedMarker, this.currentFrame);
			break;
		case DELETE_MARKER:
			this.session.deleteObservation(this.selectedMarker, event.getCamera(), this.currentFrame);
			break;
		case RESET_MARKER:
			this.session.resetMarker(this.selectedMarker, this.currentFrame);
			break;
		case RESET_FRAME:
			this.session.resetFrame(this.currentFrame);
			break;
		case ACCEPT_FRAME:
			this.session.acceptFrame(this.currentFrame);
			break;
		case SAVE:
			for (Callback<LabelingSession> cb : this.saveCallbacks) {
				cb.callback(this.session);
			}
			break;
		}
	}

	public int getSelectedMarker() {
		return selectedMarker;
	}

	public int getCurrentFrame() {
		return currentFrame;
	}

	public int getHeldCamera() {
		return heldCamera;
	}

}
