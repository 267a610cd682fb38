package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustArrayType extends RustType {

	private final RustType type;
	private final RustExpression length;

	public RustArrayType(SourceLocation location, RustType type, RustExpression length) {
		super(location);
		this.type = type;
		this.length = length;
	}

	public RustType getType() {
		return type;
	}

	public RustExpression getLength() {
		return length;
	}

	@Override
	public <T, E extends Throwable> T accept(RustTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, length);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustArrayType that = (RustArrayType) obj;
		return Objects.equals(type, that.type) &&
				Objects.equals(length, that.length);
	}

}
