package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustSliceType extends RustType {

	private final RustType type;

	public RustSliceType(SourceLocation location, RustType type) {
		super(location);
		this.type = type;
	}

	public RustType getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(RustTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustSliceType that = (RustSliceType) obj;
		return Objects.equals(type, that.type);
	}

}
