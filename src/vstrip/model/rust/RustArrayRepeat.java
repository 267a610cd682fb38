package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustArrayRepeat extends RustExpression {

	private final RustExpression value;
	private final RustExpression count;

	public RustArrayRepeat(SourceLocation location, RustExpression value, RustExpression count) {
		super(location);
		this.value = value;
		this.count = count;
	}

	public RustExpression getValue() {
		return value;
	}

	public RustExpression getCount() {
		return count;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, count);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustArrayRepeat that = (RustArrayRepeat) obj;
		return Objects.equals(value, that.value) &&
				Objects.equals(count, that.count);
	}

}
