package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

/**
 * expression matches pattern, a boolean test whose bindings are visible on
 * the right of a following `&&` or `==>`
 */
public class RustMatches extends RustExpression {

	private final RustExpression expression;
	private final RustPattern pattern;

	public RustMatches(SourceLocation location, RustExpression expression, RustPattern pattern) {
		super(location);
		this.expression = expression;
		this.pattern = pattern;
	}

	public RustExpression getExpression() {
		return expression;
	}

	public RustPattern getPattern() {
		return pattern;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression, pattern);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustMatches that = (RustMatches) obj;
		return Objects.equals(expression, that.expression) &&
				Objects.equals(pattern, that.pattern);
	}

}
