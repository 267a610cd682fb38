package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustReferencePattern extends RustPattern {

	private final boolean mutable;
	private final RustPattern pattern;

	public RustReferencePattern(SourceLocation location, boolean mutable, RustPattern pattern) {
		super(location);
		this.mutable = mutable;
		this.pattern = pattern;
	}

	public boolean isMutable() {
		return mutable;
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
		return Objects.hash(mutable, pattern);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustReferencePattern that = (RustReferencePattern) obj;
		return mutable == that.mutable &&
				Objects.equals(pattern, that.pattern);
	}

}
