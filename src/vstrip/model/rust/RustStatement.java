package vstrip.model.rust;

import vstrip.util.SourceLocation;

public abstract class RustStatement extends RustNode {

	public RustStatement(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(RustStatementVisitor<T, E> v) throws E;
}
