package vstrip.model.rust;

public enum RustMacroDelimiter {
	PAREN("(", ")"),
	BRACKET("[", "]"),
	BRACE("{", "}");

	private final String open;
	private final String close;

	RustMacroDelimiter(String open, String close) {
		this.open = open;
		this.close = close;
	}

	public String getOpen() {
		return open;
	}

	public String getClose() {
		return close;
	}

	public static RustMacroDelimiter fromOpen(String open) {
		for (RustMacroDelimiter d : values()) {
			if (d.open.equals(open)) {
				return d;
			}
		}
		return null;
	}
}
