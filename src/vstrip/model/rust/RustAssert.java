package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * assert(e), assert(e) by(strategy) requires ... and assert(e) by { proof }
 */
public class RustAssert extends RustExpression {

	private final RustExpression condition;
	private final String strategy;
	private final List<RustSpecClause> requires;
	private final RustBlock proof;

	public RustAssert(SourceLocation location, RustExpression condition, String strategy, List<RustSpecClause> requires,
	                  RustBlock proof) {
		super(location);
		this.condition = condition;
		this.strategy = strategy;
		this.requires = requires;
		this.proof = proof;
	}

	public RustExpression getCondition() {
		return condition;
	}

	public String getStrategy() {
		return strategy;
	}

	public List<RustSpecClause> getRequires() {
		return Collections.unmodifiableList(requires);
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
		return Objects.hash(condition, strategy, requires, proof);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustAssert that = (RustAssert) obj;
		return Objects.equals(condition, that.condition) &&
				Objects.equals(strategy, that.strategy) &&
				Objects.equals(requires, that.requires) &&
				Objects.equals(proof, that.proof);
	}

}
