package vstrip;

/**
 * A vstrip exception consisting of a prefix (type of error) and a message.
 */
public abstract class VStripException extends RuntimeException {
	private static final long serialVersionUID = 4416349160255911807L;

	private final String msg;
	private final String prefix;

	public VStripException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
