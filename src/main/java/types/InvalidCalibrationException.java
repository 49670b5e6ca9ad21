package types;

public class InvalidCalibrationException extends Exception {

	private static final long serialVersionUID = 1L;

	public InvalidCalibrationException(String message) {
		super(message);
	}

}
