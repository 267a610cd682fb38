package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustReferenceType extends RustType {

	private final String lifetime;
	private final boolean mutable;
	private final RustType type;

	public RustReferenceType(SourceLocation location, String lifetime, boolean mutable, RustType type) {
		super(location);
		this.lifetime = lifetime;
		this.mutable = mutable;
		this.type = type;
	}

	public String getLifetime() {
		return lifetime;
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
		return Objects.hash(lifetime, mutable, type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustReferenceType that = (RustReferenceType) obj;
		return Objects.equals(lifetime, that.lifetime) &&
				mutable == that.mutable &&
				Objects.equals(type, that.type);
	}

}
