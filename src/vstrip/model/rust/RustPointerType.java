package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustPointerType extends RustType {

	private final boolean mutable;
	private final RustType type;

	public RustPointerType(SourceLocation location, boolean mutable, RustType type) {
		super(location);
		this.mutable = mutable;
		this.type = type;
	}

	public boolean isMutable() {
		return mutable;
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
		return Objects.hash(mutable, type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustPointerType that = (RustPointerType) obj;
		return mutable == that.mutable &&
				Objects.equals(type, that.type);
	}

}
