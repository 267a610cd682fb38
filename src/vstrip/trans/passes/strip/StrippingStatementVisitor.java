package vstrip.trans.passes.strip;

import vstrip.model.rust.*;
import vstrip.trans.passes.classify.Classification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class StrippingStatementVisitor extends RustStatementVisitor<List<RustStatement>, RuntimeException> {

	private final Classification classification;
	private final StrippingExpressionVisitor expressions;

	public StrippingStatementVisitor(Classification classification) {
		this.classification = classification;
		this.expressions = new StrippingExpressionVisitor(classification, this);
	}

	StrippingExpressionVisitor expressions() {
		return expressions;
	}

	public RustBlock stripBlock(RustBlock block) {
		List<RustStatement> result = new ArrayList<>();
		for (RustStatement statement : block.getStatements()) {
			if (classification.isRetained(statement)) {
				result.addAll(statement.accept(this));
			}
		}
		return new RustBlock(block.getLocation(), result);
	}

	@Override
	public List<RustStatement> visit(RustLet rustLet) throws RuntimeException {
		RustExpression init = rustLet.getInit() == null ? null : rustLet.getInit().accept(expressions);
		RustBlock elseBlock = rustLet.getElseBlock() == null ? null : stripBlock(rustLet.getElseBlock());
		return Collections.singletonList(new RustLet(rustLet.getLocation(),
				StrippingItemVisitor.stripAttributes(classification, rustLet.getAttributes()), RustDataMode.DEFAULT,
				rustLet.getPattern(), rustLet.getType(), init, elseBlock));
	}

	@Override
	public List<RustStatement> visit(RustExpressionStatement rustExpressionStatement) throws RuntimeException {
		return Collections.singletonList(new RustExpressionStatement(rustExpressionStatement.getLocation(),
				StrippingItemVisitor.stripAttributes(classification, rustExpressionStatement.getAttributes()),
				rustExpressionStatement.getExpression().accept(expressions), rustExpressionStatement.hasSemicolon()));
	}

	@Override
	public List<RustStatement> visit(RustItemStatement rustItemStatement) throws RuntimeException {
		return Collections.singletonList(new RustItemStatement(rustItemStatement.getLocation(),
				rustItemStatement.getItem().accept(new StrippingItemVisitor(classification))));
	}

}
