package vstrip.model.rust;

import vstrip.util.SourceLocation;

public abstract class RustPattern extends RustNode {

	public RustPattern(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(RustPatternVisitor<T, E> v) throws E;
}
