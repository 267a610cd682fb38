package vstrip.model.rust;

public abstract class RustNodeVisitor<T, E extends Throwable> {

	public abstract T visit(RustItem item) throws E;
	public abstract T visit(RustStatement statement) throws E;
	public abstract T visit(RustExpression expression) throws E;
	public abstract T visit(RustPattern pattern) throws E;
	public abstract T visit(RustType type) throws E;
	public abstract T visit(RustSourceUnit rustSourceUnit) throws E;
	public abstract T visit(RustAttribute rustAttribute) throws E;
	public abstract T visit(RustParam rustParam) throws E;
	public abstract T visit(RustField rustField) throws E;
	public abstract T visit(RustVariant rustVariant) throws E;
	public abstract T visit(RustSpecClause rustSpecClause) throws E;
	public abstract T visit(RustReturnType rustReturnType) throws E;
	public abstract T visit(RustBlock rustBlock) throws E;
	public abstract T visit(RustMatchArm rustMatchArm) throws E;
	public abstract T visit(RustGenericParam rustGenericParam) throws E;
	public abstract T visit(RustWherePredicate rustWherePredicate) throws E;
	public abstract T visit(RustBound rustBound) throws E;
	public abstract T visit(RustPath rustPath) throws E;
	public abstract T visit(RustPathSegment rustPathSegment) throws E;
	public abstract T visit(RustGenericArgs rustGenericArgs) throws E;
	public abstract T visit(RustGenericArg rustGenericArg) throws E;
	public abstract T visit(RustFieldInit rustFieldInit) throws E;
	public abstract T visit(RustFieldPattern rustFieldPattern) throws E;
	public abstract T visit(RustUseTree rustUseTree) throws E;

}
