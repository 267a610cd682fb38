package vstrip.model.rust;

public abstract class RustExpressionVisitor<T, E extends Throwable> {

	public abstract T visit(RustLiteral rustLiteral) throws E;
	public abstract T visit(RustPathExpression rustPathExpression) throws E;
	public abstract T visit(RustUnary rustUnary) throws E;
	public abstract T visit(RustBinary rustBinary) throws E;
	public abstract T visit(RustCast rustCast) throws E;
	public abstract T visit(RustMatches rustMatches) throws E;
	public abstract T visit(RustCall rustCall) throws E;
	public abstract T visit(RustMethodCall rustMethodCall) throws E;
	public abstract T visit(RustFieldAccess rustFieldAccess) throws E;
	public abstract T visit(RustIndex rustIndex) throws E;
	public abstract T visit(RustTuple rustTuple) throws E;
	public abstract T visit(RustParenthesized rustParenthesized) throws E;
	public abstract T visit(RustArray rustArray) throws E;
	public abstract T visit(RustArrayRepeat rustArrayRepeat) throws E;
	public abstract T visit(RustStructLiteral rustStructLiteral) throws E;
	public abstract T visit(RustRange rustRange) throws E;
	public abstract T visit(RustBlockExpression rustBlockExpression) throws E;
	public abstract T visit(RustIf rustIf) throws E;
	public abstract T visit(RustLetCondition rustLetCondition) throws E;
	public abstract T visit(RustMatch rustMatch) throws E;
	public abstract T visit(RustWhile rustWhile) throws E;
	public abstract T visit(RustLoop rustLoop) throws E;
	public abstract T visit(RustFor rustFor) throws E;
	public abstract T visit(RustBreak rustBreak) throws E;
	public abstract T visit(RustContinue rustContinue) throws E;
	public abstract T visit(RustReturn rustReturn) throws E;
	public abstract T visit(RustClosure rustClosure) throws E;
	public abstract T visit(RustMacroCall rustMacroCall) throws E;
	public abstract T visit(RustQuantifier rustQuantifier) throws E;
	public abstract T visit(RustAssert rustAssert) throws E;
	public abstract T visit(RustAssume rustAssume) throws E;
	public abstract T visit(RustAssertForall rustAssertForall) throws E;
	public abstract T visit(RustProofBlock rustProofBlock) throws E;
	public abstract T visit(RustBigOperator rustBigOperator) throws E;

}
