package types;

import java.util.Objects;

// the 2D state of one marker in one camera at one frame
public final class Observation {

	public static final Observation EMPTY = new Observation(null, MarkerStatus.UNLABELED, false);

	private final Point2D position;
	private final MarkerStatus status;
	private final boolean handLabeled;

	public Observation(Point2D position, MarkerStatus status, boolean handLabeled) {
		this.position = position == null ? null : new Point2D(position);
		this.status = status;
		this.handLabeled = handLabeled;
	}

	public Point2D getPosition() {
		return position == null ? null : new Point2D(position);
	}

	public boolean hasPosition() {
		return position != null;
	}

	public MarkerStatus getStatus() {
		return status;
	}

	public boolean isHandLabeled() {
		return handLabeled;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Observation)) {
			return false;
		}
		Observation other = (Observation) o;
		return Objects.equals(position, other.position) && status == other.status && handLabeled == other.handLabeled;
	}

	@Override
	public int hashCode() {
		return Objects.hash(position, status, handLabeled);
	}

	public String toString() {
		return "Observation { position: " + position + ", status: " + status + ", handLabeled: " + handLabeled + " }";
	}

}
