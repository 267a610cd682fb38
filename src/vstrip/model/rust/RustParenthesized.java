package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustParenthesized extends RustExpression {

	private final RustExpression expression;

	public RustParenthesized(SourceLocation location, RustExpression expression) {
		super(location);
		this.expression = expression;
	}

	public RustExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustParenthesized that = (RustParenthesized) obj;
		return Objects.equals(expression, that.expression);
	}

}
