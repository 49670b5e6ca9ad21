package types;

public class InsufficientViewsException extends Exception {

	private static final long serialVersionUID = 1L;

	private final int views;

	public InsufficientViewsException(int views) {
		super("Triangulation needs at least 2 views, got " + views);
		this.views = views;
	}

	public int getViews() {
		return views;
	}

}
