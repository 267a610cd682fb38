package vstrip;

public class InternalCompilerError extends RuntimeException {
	private static final long serialVersionUID = -2963196427318620398L;

	public InternalCompilerError() {
		super("internal compiler error");
	}

	public InternalCompilerError(String message) {
		super("internal compiler error: " + message);
	}

	public InternalCompilerError(Exception e) {
		super("internal compiler error", e);
	}
}
