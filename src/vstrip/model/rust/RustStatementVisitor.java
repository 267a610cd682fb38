package vstrip.model.rust;

public abstract class RustStatementVisitor<T, E extends Throwable> {

	public abstract T visit(RustLet rustLet) throws E;
	public abstract T visit(RustExpressionStatement rustExpressionStatement) throws E;
	public abstract T visit(RustItemStatement rustItemStatement) throws E;

}
