package vstrip.trans.passes.strip;

import vstrip.InternalCompilerError;
import vstrip.model.rust.*;
import vstrip.trans.passes.classify.Classification;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public class StrippingExpressionVisitor extends RustExpressionVisitor<RustExpression, RuntimeException> {

	private final Classification classification;
	private final StrippingStatementVisitor statements;

	public StrippingExpressionVisitor(Classification classification, StrippingStatementVisitor statements) {
		this.classification = classification;
		this.statements = statements;
	}

	private List<RustExpression> stripAll(List<RustExpression> expressions) {
		return expressions.stream().map(e -> e.accept(this)).collect(Collectors.toList());
	}

	private RustExpression stripOptional(RustExpression expression) {
		return expression == null ? null : expression.accept(this);
	}

	// classification rejects these wherever they would survive
	private static InternalCompilerError survived(RustExpression expression) {
		return new InternalCompilerError("verification-only expression in retained code at " +
				expression.getLocation().prettyString());
	}

	@Override
	public RustExpression visit(RustLiteral rustLiteral) throws RuntimeException {
		return rustLiteral;
	}

	@Override
	public RustExpression visit(RustPathExpression rustPathExpression) throws RuntimeException {
		return rustPathExpression;
	}

	@Override
	public RustExpression visit(RustUnary rustUnary) throws RuntimeException {
		return new RustUnary(rustUnary.getLocation(), rustUnary.getOperator(), rustUnary.getOperand().accept(this),
				rustUnary.isPostfix());
	}

	@Override
	public RustExpression visit(RustBinary rustBinary) throws RuntimeException {
		return new RustBinary(rustBinary.getLocation(), rustBinary.getLhs().accept(this), rustBinary.getOperator(),
				rustBinary.getRhs().accept(this));
	}

	@Override
	public RustExpression visit(RustCast rustCast) throws RuntimeException {
		return new RustCast(rustCast.getLocation(), rustCast.getExpression().accept(this), rustCast.getType());
	}

	@Override
	public RustExpression visit(RustMatches rustMatches) throws RuntimeException {
		throw survived(rustMatches);
	}

	@Override
	public RustExpression visit(RustCall rustCall) throws RuntimeException {
		return new RustCall(rustCall.getLocation(), rustCall.getFunction().accept(this),
				stripAll(rustCall.getArguments()));
	}

	@Override
	public RustExpression visit(RustMethodCall rustMethodCall) throws RuntimeException {
		return new RustMethodCall(rustMethodCall.getLocation(), rustMethodCall.getReceiver().accept(this),
				rustMethodCall.getMethod(), stripAll(rustMethodCall.getArguments()));
	}

	@Override
	public RustExpression visit(RustFieldAccess rustFieldAccess) throws RuntimeException {
		return new RustFieldAccess(rustFieldAccess.getLocation(), rustFieldAccess.getExpression().accept(this),
				rustFieldAccess.getField());
	}

	@Override
	public RustExpression visit(RustIndex rustIndex) throws RuntimeException {
		return new RustIndex(rustIndex.getLocation(), rustIndex.getExpression().accept(this),
				rustIndex.getIndex().accept(this));
	}

	@Override
	public RustExpression visit(RustTuple rustTuple) throws RuntimeException {
		return new RustTuple(rustTuple.getLocation(), stripAll(rustTuple.getElements()));
	}

	@Override
	public RustExpression visit(RustParenthesized rustParenthesized) throws RuntimeException {
		return new RustParenthesized(rustParenthesized.getLocation(), rustParenthesized.getExpression().accept(this));
	}

	@Override
	public RustExpression visit(RustArray rustArray) throws RuntimeException {
		return new RustArray(rustArray.getLocation(), stripAll(rustArray.getElements()));
	}

	@Override
	public RustExpression visit(RustArrayRepeat rustArrayRepeat) throws RuntimeException {
		return new RustArrayRepeat(rustArrayRepeat.getLocation(), rustArrayRepeat.getValue().accept(this),
				rustArrayRepeat.getCount().accept(this));
	}

	@Override
	public RustExpression visit(RustStructLiteral rustStructLiteral) throws RuntimeException {
		List<RustFieldInit> fields = rustStructLiteral.getFields().stream()
				.filter(f -> !classification.isGhostInitializer(f))
				.map(f -> new RustFieldInit(f.getLocation(), f.getName(), stripOptional(f.getValue())))
				.collect(Collectors.toList());
		return new RustStructLiteral(rustStructLiteral.getLocation(), rustStructLiteral.getPath(), fields,
				stripOptional(rustStructLiteral.getBase()));
	}

	@Override
	public RustExpression visit(RustRange rustRange) throws RuntimeException {
		return new RustRange(rustRange.getLocation(), stripOptional(rustRange.getFrom()), rustRange.getOperator(),
				stripOptional(rustRange.getTo()));
	}

	@Override
	public RustExpression visit(RustBlockExpression rustBlockExpression) throws RuntimeException {
		return new RustBlockExpression(rustBlockExpression.getLocation(), rustBlockExpression.getLabel(),
				rustBlockExpression.getModifiers(), statements.stripBlock(rustBlockExpression.getBlock()));
	}

	@Override
	public RustExpression visit(RustIf rustIf) throws RuntimeException {
		return new RustIf(rustIf.getLocation(), rustIf.getCondition().accept(this),
				statements.stripBlock(rustIf.getThenBlock()), stripOptional(rustIf.getElseBranch()));
	}

	@Override
	public RustExpression visit(RustLetCondition rustLetCondition) throws RuntimeException {
		return new RustLetCondition(rustLetCondition.getLocation(), rustLetCondition.getPattern(),
				rustLetCondition.getExpression().accept(this));
	}

	@Override
	public RustExpression visit(RustMatch rustMatch) throws RuntimeException {
		List<RustMatchArm> arms = rustMatch.getArms().stream()
				.map(arm -> new RustMatchArm(arm.getLocation(),
						StrippingItemVisitor.stripAttributes(classification, arm.getAttributes()),
						arm.getPattern(), stripOptional(arm.getGuard()), arm.getBody().accept(this)))
				.collect(Collectors.toList());
		return new RustMatch(rustMatch.getLocation(), rustMatch.getScrutinee().accept(this), arms);
	}

	@Override
	public RustExpression visit(RustWhile rustWhile) throws RuntimeException {
		return new RustWhile(rustWhile.getLocation(), rustWhile.getLabel(), rustWhile.getCondition().accept(this),
				Collections.emptyList(), statements.stripBlock(rustWhile.getBody()));
	}

	@Override
	public RustExpression visit(RustLoop rustLoop) throws RuntimeException {
		return new RustLoop(rustLoop.getLocation(), rustLoop.getLabel(), Collections.emptyList(),
				statements.stripBlock(rustLoop.getBody()));
	}

	@Override
	public RustExpression visit(RustFor rustFor) throws RuntimeException {
		return new RustFor(rustFor.getLocation(), rustFor.getLabel(), rustFor.getPattern(), null,
				rustFor.getIterable().accept(this), Collections.emptyList(), statements.stripBlock(rustFor.getBody()));
	}

	@Override
	public RustExpression visit(RustBreak rustBreak) throws RuntimeException {
		return new RustBreak(rustBreak.getLocation(), rustBreak.getLabel(), stripOptional(rustBreak.getValue()));
	}

	@Override
	public RustExpression visit(RustContinue rustContinue) throws RuntimeException {
		return rustContinue;
	}

	@Override
	public RustExpression visit(RustReturn rustReturn) throws RuntimeException {
		return new RustReturn(rustReturn.getLocation(), stripOptional(rustReturn.getValue()));
	}

	@Override
	public RustExpression visit(RustClosure rustClosure) throws RuntimeException {
		RustReturnType returnType = rustClosure.getReturnType();
		return new RustClosure(rustClosure.getLocation(), rustClosure.getModifiers(),
				StrippingItemVisitor.stripParams(classification, rustClosure.getParams()),
				returnType == null ? null : StrippingItemVisitor.stripReturnType(returnType),
				Collections.emptyList(), rustClosure.getBody().accept(this));
	}

	@Override
	public RustExpression visit(RustMacroCall rustMacroCall) throws RuntimeException {
		return rustMacroCall;
	}

	@Override
	public RustExpression visit(RustQuantifier rustQuantifier) throws RuntimeException {
		throw survived(rustQuantifier);
	}

	@Override
	public RustExpression visit(RustAssert rustAssert) throws RuntimeException {
		throw survived(rustAssert);
	}

	@Override
	public RustExpression visit(RustAssume rustAssume) throws RuntimeException {
		throw survived(rustAssume);
	}

	@Override
	public RustExpression visit(RustAssertForall rustAssertForall) throws RuntimeException {
		throw survived(rustAssertForall);
	}

	@Override
	public RustExpression visit(RustProofBlock rustProofBlock) throws RuntimeException {
		throw survived(rustProofBlock);
	}

	@Override
	public RustExpression visit(RustBigOperator rustBigOperator) throws RuntimeException {
		throw survived(rustBigOperator);
	}

}
