package types;

// persisted as the integer code
public enum MarkerStatus {

	UNLABELED(0), INITIALIZED(1), LABELED(2), INVISIBLE(3);

	private final int code;

	private MarkerStatus(int code) {
		this.code = code;
	}

	public int getCode() {
		return code;
	}

	// usable as a triangulation input
	public boolean isEligible() {
		return this == INITIALIZED || this == LABELED;
	}

	// a position is present exactly for these states
	public boolean hasPosition() {
		return this == INITIALIZED || this == LABELED;
	}

	public static MarkerStatus fromCode(int code) {
		for (MarkerStatus status : values()) {
			if (status.code == code) {
				return status;
			}
		}
		throw new IllegalArgumentException("Unknown marker status code: " + code);
	}

}
