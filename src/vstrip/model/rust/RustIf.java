package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

/**
 * The else branch is either another RustIf or a RustBlockExpression.
 */
public class RustIf extends RustExpression {

	private final RustExpression condition;
	private final RustBlock thenBlock;
	private final RustExpression elseBranch;

	public RustIf(SourceLocation location, RustExpression condition, RustBlock thenBlock, RustExpression elseBranch) {
		super(location);
		this.condition = condition;
		this.thenBlock = thenBlock;
		this.elseBranch = elseBranch;
	}

	public RustExpression getCondition() {
		return condition;
	}

	public RustBlock getThenBlock() {
		return thenBlock;
	}

	public RustExpression getElseBranch() {
		return elseBranch;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, thenBlock, elseBranch);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustIf that = (RustIf) obj;
		return Objects.equals(condition, that.condition) &&
				Objects.equals(thenBlock, that.thenBlock) &&
				Objects.equals(elseBranch, that.elseBranch);
	}

}
