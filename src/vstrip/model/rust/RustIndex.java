package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustIndex extends RustExpression {

	private final RustExpression expression;
	private final RustExpression index;

	public RustIndex(SourceLocation location, RustExpression expression, RustExpression index) {
		super(location);
		this.expression = expression;
		this.index = index;
	}

	public RustExpression getExpression() {
		return expression;
	}

	public RustExpression getIndex() {
		return index;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression, index);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustIndex that = (RustIndex) obj;
		return Objects.equals(expression, that.expression) &&
				Objects.equals(index, that.index);
	}

}
