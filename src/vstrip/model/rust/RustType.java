package vstrip.model.rust;

import vstrip.util.SourceLocation;

public abstract class RustType extends RustNode {

	public RustType(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(RustNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(RustTypeVisitor<T, E> v) throws E;
}
