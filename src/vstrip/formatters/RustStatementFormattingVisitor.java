package vstrip.formatters;

import vstrip.model.rust.*;

import java.io.IOException;

public class RustStatementFormattingVisitor extends RustStatementVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final RustNodeFormattingVisitor nodes;

	public RustStatementFormattingVisitor(IndentingWriter out) {
		this.out = out;
		this.nodes = new RustNodeFormattingVisitor(out);
	}

	@Override
	public Void visit(RustLet rustLet) throws IOException {
		nodes.writeAttributes(rustLet.getAttributes());
		out.write("let ");
		nodes.writeMode(rustLet.getMode());
		rustLet.getPattern().accept(nodes);
		if (rustLet.getType() != null) {
			out.write(": ");
			rustLet.getType().accept(nodes);
		}
		if (rustLet.getInit() != null) {
			out.write(" = ");
			rustLet.getInit().accept(nodes);
		}
		if (rustLet.getElseBlock() != null) {
			out.write(" else ");
			rustLet.getElseBlock().accept(nodes);
		}
		out.write(";");
		return null;
	}

	@Override
	public Void visit(RustExpressionStatement rustExpressionStatement) throws IOException {
		nodes.writeAttributes(rustExpressionStatement.getAttributes());
		rustExpressionStatement.getExpression().accept(nodes);
		if (rustExpressionStatement.hasSemicolon()) {
			out.write(";");
		}
		return null;
	}

	@Override
	public Void visit(RustItemStatement rustItemStatement) throws IOException {
		rustItemStatement.getItem().accept(nodes);
		return null;
	}

}
