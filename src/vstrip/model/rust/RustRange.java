package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustRange extends RustExpression {

	private final RustExpression from;
	private final String operator;
	private final RustExpression to;

	public RustRange(SourceLocation location, RustExpression from, String operator, RustExpression to) {
		super(location);
		this.from = from;
		this.operator = operator;
		this.to = to;
	}

	public RustExpression getFrom() {
		return from;
	}

	public String getOperator() {
		return operator;
	}

	public RustExpression getTo() {
		return to;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(from, operator, to);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustRange that = (RustRange) obj;
		return Objects.equals(from, that.from) &&
				Objects.equals(operator, that.operator) &&
				Objects.equals(to, that.to);
	}

}
