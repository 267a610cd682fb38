package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustReturn extends RustExpression {

	private final RustExpression value;

	public RustReturn(SourceLocation location, RustExpression value) {
		super(location);
		this.value = value;
	}

	public RustExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
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
		RustReturn that = (RustReturn) obj;
		return Objects.equals(value, that.value);
	}

}
