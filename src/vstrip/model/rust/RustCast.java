package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustCast extends RustExpression {

	private final RustExpression expression;
	private final RustType type;

	public RustCast(SourceLocation location, RustExpression expression, RustType type) {
		super(location);
		this.expression = expression;
		this.type = type;
	}

	public RustExpression getExpression() {
		return expression;
	}

	public RustType getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression, type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustCast that = (RustCast) obj;
		return Objects.equals(expression, that.expression) &&
				Objects.equals(type, that.type);
	}

}
