package types;

public class InvalidRangeException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public InvalidRangeException(String message) {
		super(message);
	}

}
