package vstrip.trans.passes.classify;

import vstrip.errors.IssueContext;
import vstrip.lexer.RustToken;
import vstrip.model.rust.*;

import java.util.List;

/**
 * Walks an expression that is kept by the stripper. Blocks inside it are
 * classified statement by statement; verification-only expressions inside it
 * cannot be removed without changing the program and are reported.
 */
public class ClassificationExpressionVisitor extends RustExpressionVisitor<Void, RuntimeException> {

	private final IssueContext ctx;
	private final Classification classification;
	private final ClassificationStatementVisitor statements;

	public ClassificationExpressionVisitor(IssueContext ctx, Classification classification,
	                                       ClassificationStatementVisitor statements) {
		this.ctx = ctx;
		this.classification = classification;
		this.statements = statements;
	}

	public ClassificationExpressionVisitor(IssueContext ctx, Classification classification) {
		this(ctx, classification, new ClassificationStatementVisitor(ctx, classification));
	}

	private void visitAll(List<RustExpression> expressions) {
		for (RustExpression expression : expressions) {
			expression.accept(this);
		}
	}

	private void visitOptional(RustExpression expression) {
		if (expression != null) {
			expression.accept(this);
		}
	}

	private void reject(RustExpression expression, String description) {
		ctx.error(new UnsupportedConstructIssue(expression.getLocation(), description +
				" inside executable code"));
	}

	@Override
	public Void visit(RustLiteral rustLiteral) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(RustPathExpression rustPathExpression) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(RustUnary rustUnary) throws RuntimeException {
		if (DialectMarkers.isGhostOperator(rustUnary)) {
			reject(rustUnary, "view operator `@`");
			return null;
		}
		rustUnary.getOperand().accept(this);
		return null;
	}

	@Override
	public Void visit(RustBinary rustBinary) throws RuntimeException {
		if (DialectMarkers.isGhostOperator(rustBinary)) {
			reject(rustBinary, "ghost operator `" + rustBinary.getOperator() + "`");
			return null;
		}
		rustBinary.getLhs().accept(this);
		rustBinary.getRhs().accept(this);
		return null;
	}

	@Override
	public Void visit(RustCast rustCast) throws RuntimeException {
		rustCast.getExpression().accept(this);
		return null;
	}

	@Override
	public Void visit(RustMatches rustMatches) throws RuntimeException {
		reject(rustMatches, "ghost operator `matches`");
		return null;
	}

	@Override
	public Void visit(RustCall rustCall) throws RuntimeException {
		rustCall.getFunction().accept(this);
		visitAll(rustCall.getArguments());
		return null;
	}

	@Override
	public Void visit(RustMethodCall rustMethodCall) throws RuntimeException {
		rustMethodCall.getReceiver().accept(this);
		visitAll(rustMethodCall.getArguments());
		return null;
	}

	@Override
	public Void visit(RustFieldAccess rustFieldAccess) throws RuntimeException {
		rustFieldAccess.getExpression().accept(this);
		return null;
	}

	@Override
	public Void visit(RustIndex rustIndex) throws RuntimeException {
		rustIndex.getExpression().accept(this);
		rustIndex.getIndex().accept(this);
		return null;
	}

	@Override
	public Void visit(RustTuple rustTuple) throws RuntimeException {
		visitAll(rustTuple.getElements());
		return null;
	}

	@Override
	public Void visit(RustParenthesized rustParenthesized) throws RuntimeException {
		rustParenthesized.getExpression().accept(this);
		return null;
	}

	@Override
	public Void visit(RustArray rustArray) throws RuntimeException {
		visitAll(rustArray.getElements());
		return null;
	}

	@Override
	public Void visit(RustArrayRepeat rustArrayRepeat) throws RuntimeException {
		rustArrayRepeat.getValue().accept(this);
		rustArrayRepeat.getCount().accept(this);
		return null;
	}

	@Override
	public Void visit(RustStructLiteral rustStructLiteral) throws RuntimeException {
		String typeName = rustStructLiteral.getPath().getLastName();
		for (RustFieldInit field : rustStructLiteral.getFields()) {
			GhostMarker marker = GhostMarker.NONE;
			if (classification.isGhostField(typeName, field.getName())) {
				marker = GhostMarker.GHOST;
			} else if (field.getValue() != null) {
				marker = DialectMarkers.wrapperMarker(field.getValue());
			}
			classification.setGhostMarker(field, marker);
			if (marker == GhostMarker.NONE) {
				visitOptional(field.getValue());
			}
		}
		visitOptional(rustStructLiteral.getBase());
		return null;
	}

	@Override
	public Void visit(RustRange rustRange) throws RuntimeException {
		visitOptional(rustRange.getFrom());
		visitOptional(rustRange.getTo());
		return null;
	}

	@Override
	public Void visit(RustBlockExpression rustBlockExpression) throws RuntimeException {
		statements.classifyBlock(rustBlockExpression.getBlock());
		return null;
	}

	@Override
	public Void visit(RustIf rustIf) throws RuntimeException {
		rustIf.getCondition().accept(this);
		statements.classifyBlock(rustIf.getThenBlock());
		visitOptional(rustIf.getElseBranch());
		return null;
	}

	@Override
	public Void visit(RustLetCondition rustLetCondition) throws RuntimeException {
		rustLetCondition.getExpression().accept(this);
		return null;
	}

	@Override
	public Void visit(RustMatch rustMatch) throws RuntimeException {
		rustMatch.getScrutinee().accept(this);
		for (RustMatchArm arm : rustMatch.getArms()) {
			ClassificationItemVisitor.classifyAttributes(classification, arm.getAttributes());
			visitOptional(arm.getGuard());
			arm.getBody().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(RustWhile rustWhile) throws RuntimeException {
		rustWhile.getCondition().accept(this);
		ClassificationItemVisitor.classifySpecClauses(classification, rustWhile.getSpecClauses());
		statements.classifyBlock(rustWhile.getBody());
		return null;
	}

	@Override
	public Void visit(RustLoop rustLoop) throws RuntimeException {
		ClassificationItemVisitor.classifySpecClauses(classification, rustLoop.getSpecClauses());
		statements.classifyBlock(rustLoop.getBody());
		return null;
	}

	@Override
	public Void visit(RustFor rustFor) throws RuntimeException {
		rustFor.getIterable().accept(this);
		ClassificationItemVisitor.classifySpecClauses(classification, rustFor.getSpecClauses());
		statements.classifyBlock(rustFor.getBody());
		return null;
	}

	@Override
	public Void visit(RustBreak rustBreak) throws RuntimeException {
		visitOptional(rustBreak.getValue());
		return null;
	}

	@Override
	public Void visit(RustContinue rustContinue) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(RustReturn rustReturn) throws RuntimeException {
		visitOptional(rustReturn.getValue());
		return null;
	}

	@Override
	public Void visit(RustClosure rustClosure) throws RuntimeException {
		ClassificationItemVisitor.classifyParams(classification, rustClosure.getParams());
		ClassificationItemVisitor.classifySpecClauses(classification, rustClosure.getSpecClauses());
		RustReturnType returnType = rustClosure.getReturnType();
		if (returnType != null && returnType.getMode() != RustDataMode.DEFAULT) {
			reject(rustClosure, "closure with a tracked return value");
		}
		rustClosure.getBody().accept(this);
		return null;
	}

	@Override
	public Void visit(RustMacroCall rustMacroCall) throws RuntimeException {
		RustPath path = rustMacroCall.getPath();
		if (DialectMarkers.isWrapperMacro(path)) {
			reject(rustMacroCall, "nested `verus!` wrapper");
			return null;
		}
		if (DialectMarkers.isProofMacro(path)) {
			ctx.error(new UnsupportedConstructIssue(rustMacroCall.getLocation(), "proof macro `" +
					path.getLastName() + "!` outside statement position"));
			return null;
		}
		RustToken marker = DialectMarkers.findMarker(rustMacroCall.getTokens());
		if (marker != null) {
			ctx.error(new UnsupportedConstructIssue(marker.getLocation(), "verification syntax `" +
					marker.getValue() + "` inside the arguments of `" + path.getLastName() + "!`"));
		}
		return null;
	}

	@Override
	public Void visit(RustQuantifier rustQuantifier) throws RuntimeException {
		reject(rustQuantifier, "quantifier `" + rustQuantifier.getQuantifier() + "`");
		return null;
	}

	@Override
	public Void visit(RustAssert rustAssert) throws RuntimeException {
		reject(rustAssert, "`assert`");
		return null;
	}

	@Override
	public Void visit(RustAssume rustAssume) throws RuntimeException {
		reject(rustAssume, "`assume`");
		return null;
	}

	@Override
	public Void visit(RustAssertForall rustAssertForall) throws RuntimeException {
		reject(rustAssertForall, "`assert forall`");
		return null;
	}

	@Override
	public Void visit(RustProofBlock rustProofBlock) throws RuntimeException {
		reject(rustProofBlock, "`proof` block");
		return null;
	}

	@Override
	public Void visit(RustBigOperator rustBigOperator) throws RuntimeException {
		reject(rustBigOperator, "big operator `" + rustBigOperator.getOperator() + "`");
		return null;
	}

}
