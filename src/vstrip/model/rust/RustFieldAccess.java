package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

/**
 * expr.field, expr.0 and expr.await
 */
public class RustFieldAccess extends RustExpression {

	private final RustExpression expression;
	private final String field;

	public RustFieldAccess(SourceLocation location, RustExpression expression, String field) {
		super(location);
		this.expression = expression;
		this.field = field;
	}

	public RustExpression getExpression() {
		return expression;
	}

	public String getField() {
		return field;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression, field);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustFieldAccess that = (RustFieldAccess) obj;
		return Objects.equals(expression, that.expression) &&
				Objects.equals(field, that.field);
	}

}
