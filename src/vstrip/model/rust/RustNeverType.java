package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustNeverType extends RustType {

	public RustNeverType(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(RustTypeVisitor<T, E> v) throws E {
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
