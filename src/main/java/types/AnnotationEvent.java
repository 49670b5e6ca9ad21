package types;

// a user action, already reduced from mouse/keyboard input
public class AnnotationEvent {

	public enum Kind {
		SELECT_MARKER, NEXT_MARKER, PREVIOUS_MARKER, SET_FRAME, CLICK, HOLD, RELEASE, TRIANGULATE, SWAP_IDENTITIES,
		TOGGLE_INVISIBLE, DELETE_MARKER, RESET_MARKER, RESET_FRAME, ACCEPT_FRAME, SAVE
	}

	private Kind kind;
	private int marker = -1;
	private int camera = -1;
	private int frame = -1;
	private Point2D position = null;

	public AnnotationEvent(Kind kind) {
		this.kind = kind;
	}

	public static AnnotationEvent selectMarker(int marker) {
		AnnotationEvent e = new AnnotationEvent(Kind.SELECT_MARKER);
		e.marker = marker;
		return e;
	}

	public static AnnotationEvent setFrame(int frame) {
		AnnotationEvent e = new AnnotationEvent(Kind.SET_FRAME);
		e.frame = frame;
		return e;
	}

	public static AnnotationEvent click(int camera, Point2D position) {
		AnnotationEvent e = new AnnotationEvent(Kind.CLICK);
		e.camera = camera;
		e.position = position;
		return e;
	}

	public static AnnotationEvent hold(int camera, Point2D position) {
		AnnotationEvent e = new AnnotationEvent(Kind.HOLD);
		e.camera = camera;
		e.position = position;
		return e;
	}

	public static AnnotationEvent swapIdentities(int camera) {
		AnnotationEvent e = new AnnotationEvent(Kind.SWAP_IDENTITIES);
		e.camera = camera;
		return e;
	}

	public static AnnotationEvent deleteMarker(int camera) {
		AnnotationEvent e = new AnnotationEvent(Kind.DELETE_MARKER);
		e.camera = camera;
		return e;
	}

	public Kind getKind() {
		return kind;
	}

	public int getMarker() {
		return marker;
	}

	public int getCamera() {
		return camera;
	}

	public int getFrame() {
		return frame;
	}

	public Point2D getPosition() {
		return position;
	}

	public String toString() {
		return "AnnotationEvent { kind: " + kind + ", marker: " + marker + ", camera: " + camera + ", frame: " + frame
				+ ", position: " + position + " }";
	}

}
