package vstrip.parser;

import vstrip.util.SourceLocation;

/**
 * Raised by the lexer and the parser when the input cannot be read as Rust
 * extended with Verus.
 */
public class ParseFailureException extends Exception {
	private static final long serialVersionUID = -7709426017352185573L;

	private final SourceLocation location;
	private final String description;

	public ParseFailureException(SourceLocation location, String description) {
		super(description + " " + location.prettyString());
		this.location = location;
		this.description = description;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getDescription() {
		return description;
	}
}
