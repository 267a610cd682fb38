package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustParenthesizedPattern extends RustPattern {

	private final RustPattern pattern;

	public RustParenthesizedPattern(SourceLocation location, RustPattern pattern) {
		super(location);
		this.pattern = pattern;
	}

	public RustPattern getPattern() {
		return pattern;
	}

	@Override
	public <T, E extends Throwable> T accept(RustPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(pattern);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustParenthesizedPattern that = (RustParenthesizedPattern) obj;
		return Objects.equals(pattern, that.pattern);
	}

}
