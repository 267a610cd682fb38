package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The prefix conjunction and disjunction lists &&& a &&& b and ||| a ||| b.
 */
public class RustBigOperator extends RustExpression {

	private final String operator;
	private final List<RustExpression> operands;

	public RustBigOperator(SourceLocation location, String operator, List<RustExpression> operands) {
		super(location);
		this.operator = operator;
		this.operands = operands;
	}

	public String getOperator() {
		return operator;
	}

	public List<RustExpression> getOperands() {
		return Collections.unmodifiableList(operands);
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, operands);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustBigOperator that = (RustBigOperator) obj;
		return Objects.equals(operator, that.operator) &&
				Objects.equals(operands, that.operands);
	}

}
