package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * assert forall|x: T| condition implies conclusion by { proof }
 */
public class RustAssertForall extends RustExpression {

	private final List<RustParam> params;
	private final RustExpression condition;
	private final RustExpression implies;
	private final RustBlock proof;

	public RustAssertForall(SourceLocation location, List<RustParam> params, RustExpression condition,
	                        RustExpression implies, RustBlock proof) {
		super(location);
		this.params = params;
		this.condition = condition;
		this.implies = implies;
		this.proof = proof;
	}

	public List<RustParam> getParams() {
		return Collections.unmodifiableList(params);
	}

	public RustExpression getCondition() {
		return condition;
	}

	public RustExpression getImplies() {
		return implies;
	}

	public RustBlock getProof() {
		return proof;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(params, condition, implies, proof);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustAssertForall that = (RustAssertForall) obj;
		return Objects.equals(params, that.params) &&
				Objects.equals(condition, that.condition) &&
				Objects.equals(implies, that.implies) &&
				Objects.equals(proof, that.proof);
	}

}
