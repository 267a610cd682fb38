package vstrip.trans;

/**
 * The printed output for one input file. A result is empty when no item of
 * the file survived stripping.
 */
public class StripResult {

	private final String text;
	private final boolean empty;

	public StripResult(String text, boolean empty) {
		this.text = text;
		this.empty = empty;
	}

	public String getText() {
		return text;
	}

	public boolean isEmpty() {
		return empty;
	}

}
