package vstrip.lexer;

import vstrip.util.SourceLocatable;
import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustToken extends SourceLocatable {

	private final String value;
	private final RustTokenType type;
	private final SourceLocation location;

	public RustToken(String value, RustTokenType type, SourceLocation location) {
		this.value = value;
		this.type = type;
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getValue() {
		return value;
	}

	public RustTokenType getType() {
		return type;
	}

	public boolean is(RustTokenType type, String value) {
		return this.type == type && this.value.equals(value);
	}

	public boolean isPunct(String value) {
		return is(RustTokenType.PUNCT, value);
	}

	public boolean isIdent(String value) {
		return is(RustTokenType.IDENT, value);
	}

	public boolean isLiteral() {
		return type == RustTokenType.INTEGER || type == RustTokenType.FLOAT || type == RustTokenType.STRING ||
				type == RustTokenType.CHAR;
	}

	@Override
	public String toString() {
		return "RustToken [value=" + value + ", type=" + type + ", location=" + location + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		RustToken other = (RustToken) obj;
		// the location is not part of a token's identity
		return type == other.type && Objects.equals(value, other.value);
	}

}
