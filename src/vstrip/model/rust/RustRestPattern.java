package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustRestPattern extends RustPattern {

	public RustRestPattern(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(RustPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		return true;
	}

}
