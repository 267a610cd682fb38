package vstrip.model.rust;

public abstract class RustItemVisitor<T, E extends Throwable> {

	public abstract T visit(RustFunction rustFunction) throws E;
	public abstract T visit(RustStruct rustStruct) throws E;
	public abstract T visit(RustEnum rustEnum) throws E;
	public abstract T visit(RustImpl rustImpl) throws E;
	public abstract T visit(RustTrait rustTrait) throws E;
	public abstract T visit(RustConst rustConst) throws E;
	public abstract T visit(RustTypeAlias rustTypeAlias) throws E;
	public abstract T visit(RustModule rustModule) throws E;
	public abstract T visit(RustUse rustUse) throws E;
	public abstract T visit(RustMacroItem rustMacroItem) throws E;
	public abstract T visit(RustBroadcastGroup rustBroadcastGroup) throws E;
	public abstract T visit(RustVerbatimItem rustVerbatimItem) throws E;

}
