package vstrip;

public class Unreachable extends RuntimeException {
	private static final long serialVersionUID = 8237455263151307416L;

	public Unreachable() {
		super("unreachable");
	}

	public Unreachable(Exception e) {
		super("unreachable", e);
	}
}
