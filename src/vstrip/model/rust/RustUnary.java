package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

/**
 * Prefix operators (-, !, *, &, &mut) and the postfix ? operator.
 */
public class RustUnary extends RustExpression {

	private final String operator;
	private final RustExpression operand;
	private final boolean postfix;

	public RustUnary(SourceLocation location, String operator, RustExpression operand, boolean postfix) {
		super(location);
		this.operator = operator;
		this.operand = operand;
		this.postfix = postfix;
	}

	public String getOperator() {
		return operator;
	}

	public RustExpression getOperand() {
		return operand;
	}

	public boolean isPostfix() {
		return postfix;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, operand, postfix);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustUnary that = (RustUnary) obj;
		return Objects.equals(operator, that.operator) &&
				Objects.equals(operand, that.operand) &&
				postfix == that.postfix;
	}

}
