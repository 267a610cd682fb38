package vstrip.model.rust;

public abstract class RustPatternVisitor<T, E extends Throwable> {

	public abstract T visit(RustIdentPattern rustIdentPattern) throws E;
	public abstract T visit(RustWildcardPattern rustWildcardPattern) throws E;
	public abstract T visit(RustRestPattern rustRestPattern) throws E;
	public abstract T visit(RustLiteralPattern rustLiteralPattern) throws E;
	public abstract T visit(RustRangePattern rustRangePattern) throws E;
	public abstract T visit(RustPathPattern rustPathPattern) throws E;
	public abstract T visit(RustTupleStructPattern rustTupleStructPattern) throws E;
	public abstract T visit(RustStructPattern rustStructPattern) throws E;
	public abstract T visit(RustTuplePattern rustTuplePattern) throws E;
	public abstract T visit(RustParenthesizedPattern rustParenthesizedPattern) throws E;
	public abstract T visit(RustSlicePattern rustSlicePattern) throws E;
	public abstract T visit(RustReferencePattern rustReferencePattern) throws E;
	public abstract T visit(RustOrPattern rustOrPattern) throws E;

}
