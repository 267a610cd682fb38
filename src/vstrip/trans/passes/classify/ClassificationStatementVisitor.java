package vstrip.trans.passes.classify;

import vstrip.errors.IssueContext;
import vstrip.model.rust.*;

public class ClassificationStatementVisitor extends RustStatementVisitor<Void, RuntimeException> {

	private final IssueContext ctx;
	private final Classification classification;

	public ClassificationStatementVisitor(IssueContext ctx, Classification classification) {
		this.ctx = ctx;
		this.classification = classification;
	}

	public void classifyBlock(RustBlock block) {
		for (RustStatement statement : block.getStatements()) {
			statement.accept(this);
		}
	}

	private void check(RustExpression expression) {
		if (expression != null) {
			expression.accept(new ClassificationExpressionVisitor(ctx, classification, this));
		}
	}

	private static boolean isGhostLet(RustLet rustLet) {
		if (rustLet.getMode() != RustDataMode.DEFAULT) {
			return true;
		}
		if (DialectMarkers.wrapperMarker(rustLet.getPattern()) != GhostMarker.NONE) {
			return true;
		}
		if (rustLet.getType() != null && DialectMarkers.wrapperMarker(rustLet.getType()) != GhostMarker.NONE) {
			return true;
		}
		return rustLet.getInit() != null && DialectMarkers.isWrapperConstruction(rustLet.getInit());
	}

	/**
	 * @return the kind of a statement made of expression alone
	 */
	private static Kind expressionKind(RustExpression expression) {
		if (expression instanceof RustAssert || expression instanceof RustAssume ||
				expression instanceof RustAssertForall || expression instanceof RustProofBlock) {
			return Kind.PROOF;
		}
		if (expression instanceof RustMacroCall && DialectMarkers.isProofMacro(((RustMacroCall) expression).getPath())) {
			return Kind.PROOF;
		}
		if (DialectMarkers.isProofBuiltinCall(expression)) {
			return Kind.PROOF;
		}
		if (expression instanceof RustQuantifier || DialectMarkers.isGhostOperator(expression) ||
				DialectMarkers.isWrapperConstruction(expression)) {
			return Kind.GHOST_DATA;
		}
		return Kind.EXECUTABLE;
	}

	@Override
	public Void visit(RustLet rustLet) throws RuntimeException {
		ClassificationItemVisitor.classifyAttributes(classification, rustLet.getAttributes());
		if (isGhostLet(rustLet)) {
			classification.setKind(rustLet, Kind.GHOST_DATA);
			return null;
		}
		classification.setKind(rustLet, Kind.EXECUTABLE);
		check(rustLet.getInit());
		if (rustLet.getElseBlock() != null) {
			classifyBlock(rustLet.getElseBlock());
		}
		return null;
	}

	@Override
	public Void visit(RustExpressionStatement rustExpressionStatement) throws RuntimeException {
		ClassificationItemVisitor.classifyAttributes(classification, rustExpressionStatement.getAttributes());
		Kind kind = expressionKind(rustExpressionStatement.getExpression());
		if (kind == Kind.GHOST_DATA && !rustExpressionStatement.hasSemicolon()) {
			// the value of its block, so it cannot be erased
			kind = Kind.EXECUTABLE;
		}
		classification.setKind(rustExpressionStatement, kind);
		if (kind == Kind.EXECUTABLE) {
			check(rustExpressionStatement.getExpression());
		}
		return null;
	}

	@Override
	public Void visit(RustItemStatement rustItemStatement) throws RuntimeException {
		rustItemStatement.getItem().accept(new ClassificationItemVisitor(ctx, classification));
		classification.setKind(rustItemStatement, classification.getKind(rustItemStatement.getItem()));
		return null;
	}

}
