package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustLiteralPattern extends RustPattern {

	private final String value;

	public RustLiteralPattern(SourceLocation location, String value) {
		super(location);
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(RustPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustLiteralPattern that = (RustLiteralPattern) obj;
		return Objects.equals(value, that.value);
	}

}
