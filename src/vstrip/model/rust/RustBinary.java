package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

/**
 * Binary operators, including assignments and the verification-only operators such as ==>.
 */
public class RustBinary extends RustExpression {

	private final RustExpression lhs;
	private final String operator;
	private final RustExpression rhs;

	public RustBinary(SourceLocation location, RustExpression lhs, String operator, RustExpression rhs) {
		super(location);
		this.lhs = lhs;
		this.operator = operator;
		this.rhs = rhs;
	}

	public RustExpression getLhs() {
		return lhs;
	}

	public String getOperator() {
		return operator;
	}

	public RustExpression getRhs() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lhs, operator, rhs);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustBinary that = (RustBinary) obj;
		return Objects.equals(lhs, that.lhs) &&
				Objects.equals(operator, that.operator) &&
				Objects.equals(rhs, that.rhs);
	}

}
