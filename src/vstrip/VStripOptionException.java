package vstrip;

public class VStripOptionException extends VStripException {
	private static final long serialVersionUID = 7381042205935371548L;

	private static final String prefix = "Option Error";

	public VStripOptionException(String msg) {
		super(prefix, msg);
	}
}
