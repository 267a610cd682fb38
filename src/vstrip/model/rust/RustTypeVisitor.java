package vstrip.model.rust;

public abstract class RustTypeVisitor<T, E extends Throwable> {

	public abstract T visit(RustPathType rustPathType) throws E;
	public abstract T visit(RustReferenceType rustReferenceType) throws E;
	public abstract T visit(RustPointerType rustPointerType) throws E;
	public abstract T visit(RustTupleType rustTupleType) throws E;
	public abstract T visit(RustParenthesizedType rustParenthesizedType) throws E;
	public abstract T visit(RustSliceType rustSliceType) throws E;
	public abstract T visit(RustArrayType rustArrayType) throws E;
	public abstract T visit(RustFunctionPointerType rustFunctionPointerType) throws E;
	public abstract T visit(RustTraitObjectType rustTraitObjectType) throws E;
	public abstract T visit(RustNeverType rustNeverType) throws E;
	public abstract T visit(RustInferType rustInferType) throws E;

}
