package types;

public class DegenerateGeometryException extends Exception {

	private static final long serialVersionUID = 1L;

	public DegenerateGeometryException(String message) {
		super(message);
	}

}
