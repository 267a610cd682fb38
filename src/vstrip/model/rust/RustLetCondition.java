package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

/**
 * let pattern = expr, as found in if let and while let conditions
 */
public class RustLetCondition extends RustExpression {

	private final RustPattern pattern;
	private final RustExpression expression;

	public RustLetCondition(SourceLocation location, RustPattern pattern, RustExpression expression) {
		super(location);
		this.pattern = pattern;
		this.expression = expression;
	}

	public RustPattern getPattern() {
		return pattern;
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
		return Objects.hash(pattern, expression);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustLetCondition that = (RustLetCondition) obj;
		return Objects.equals(pattern, that.pattern) &&
				Objects.equals(expression, that.expression);
	}

}
