package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustAssume extends RustExpression {

	private final RustExpression condition;

	public RustAssume(SourceLocation location, RustExpression condition) {
		super(location);
		this.condition = condition;
	}

	public RustExpression getCondition() {
		return condition;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustAssume that = (RustAssume) obj;
		return Objects.equals(condition, that.condition);
	}

}
