package vstrip.model.rust;

import vstrip.util.SourceLocation;

import java.util.Objects;

public class RustProofBlock extends RustExpression {

	private final RustBlock block;

	public RustProofBlock(SourceLocation location, RustBlock block) {
		super(location);
		this.block = block;
	}

	public RustBlock getBlock() {
		return block;
	}

	@Override
	public <T, E extends Throwable> T accept(RustExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(block);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != this.getClass()) {
			return false;
		}
		RustProofBlock that = (RustProofBlock) obj;
		return Objects.equals(block, that.block);
	}

}
