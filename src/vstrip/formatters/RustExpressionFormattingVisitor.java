package vstrip.formatters;

import vstrip.model.rust.*;

import java.io.IOException;
import java.util.List;

public class RustExpressionFormattingVisitor extends RustExpressionVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final RustNodeFormattingVisitor nodes;

	public RustExpressionFormattingVisitor(IndentingWriter out) {
		this.out = out;
		this.nodes = new RustNodeFormattingVisitor(out);
	}

	private void writeLabel(String label) throws IOException {
		if (label != null) {
			out.write(label);
			out.write(": ");
		}
	}

	private void writeArguments(List<RustExpression> arguments) throws IOException {
		out.write("(");
		FormattingTools.writeCommaSeparated(out, arguments, a -> a.accept(this));
		out.write(")");
	}

	private void writeLoopBody(List<RustSpecClause> specClauses, RustBlock body) throws IOException {
		boolean freshLine = nodes.writeSignatureTrailer(List.of(), specClauses);
		nodes.writeBody(body, freshLine);
	}

	private void writeQuantifierParams(List<RustParam> params) throws IOException {
		out.write("|");
		FormattingTools.writeCommaSeparated(out, params, p -> p.accept(nodes));
		out.write("|");
	}

	@Override
	public Void visit(RustLiteral rustLiteral) throws IOException {
		out.writeVerbatim(rustLiteral.getValue());
		return null;
	}

	@Override
	public Void visit(RustPathExpression rustPathExpression) throws IOException {
		rustPathExpression.getPath().accept(nodes);
		return null;
	}

	@Override
	public Void visit(RustUnary rustUnary) throws IOException {
		if (rustUnary.isPostfix()) {
			rustUnary.getOperand().accept(this);
			out.write(rustUnary.getOperator());
		} else {
			out.write(rustUnary.getOperator());
			if (rustUnary.getOperator().equals("&mut")) {
				out.write(" ");
			}
			rustUnary.getOperand().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(RustBinary rustBinary) throws IOException {
		rustBinary.getLhs().accept(this);
		out.write(" ");
		out.write(rustBinary.getOperator());
		out.write(" ");
		rustBinary.getRhs().accept(this);
		return null;
	}

	@Override
	public Void visit(RustCast rustCast) throws IOException {
		rustCast.getExpression().accept(this);
		out.write(" as ");
		rustCast.getType().accept(nodes);
		return null;
	}

	@Override
	public Void visit(RustMatches rustMatches) throws IOException {
		rustMatches.getExpression().accept(this);
		out.write(" matches ");
		rustMatches.getPattern().accept(nodes);
		return null;
	}

	@Override
	public Void visit(RustCall rustCall) throws IOException {
		rustCall.getFunction().accept(this);
		writeArguments(rustCall.getArguments());
		return null;
	}

	@Override
	public Void visit(RustMethodCall rustMethodCall) throws IOException {
		rustMethodCall.getReceiver().accept(this);
		out.write(".");
		rustMethodCall.getMethod().accept(nodes);
		writeArguments(rustMethodCall.getArguments());
		return null;
	}

	@Override
	public Void visit(RustFieldAccess rustFieldAccess) throws IOException {
		rustFieldAccess.getExpression().accept(this);
		out.write(".");
		out.write(rustFieldAccess.getField());
		return null;
	}

	@Override
	public Void visit(RustIndex rustIndex) throws IOException {
		rustIndex.getExpression().accept(this);
		out.write("[");
		rustIndex.getIndex().accept(this);
		out.write("]");
		return null;
	}

	@Override
	public Void visit(RustTuple rustTuple) throws IOException {
		out.write("(");
		FormattingTools.writeCommaSeparated(out, rustTuple.getElements(), e -> e.accept(this));
		if (rustTuple.getElements().size() == 1) {
			out.write(",");
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(RustParenthesized rustParenthesized) throws IOException {
		out.write("(");
		rustParenthesized.getExpression().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(RustArray rustArray) throws IOException {
		out.write("[");
		FormattingTools.writeCommaSeparated(out, rustArray.getElements(), e -> e.accept(this));
		out.write("]");
		return null;
	}

	@Override
	public Void visit(RustArrayRepeat rustArrayRepeat) throws IOException {
		out.write("[");
		rustArrayRepeat.getValue().accept(this);
		out.write("; ");
		rustArrayRepeat.getCount().accept(this);
		out.write("]");
		return null;
	}

	@Override
	public Void visit(RustStructLiteral rustStructLiteral) throws IOException {
		rustStructLiteral.getPath().accept(nodes);
		if (rustStructLiteral.getFields().isEmpty() && rustStructLiteral.getBase() == null) {
			out.write(" {}");
			return null;
		}
		out.write(" { ");
		FormattingTools.writeCommaSeparated(out, rustStructLiteral.getFields(), f -> f.accept(nodes));
		if (rustStructLiteral.getBase() != null) {
			if (!rustStructLiteral.getFields().isEmpty()) {
				out.write(", ");
			}
			out.write("..");
			rustStructLiteral.getBase().accept(this);
		}
		out.write(" }");
		return null;
	}

	@Override
	public Void visit(RustRange rustRange) throws IOException {
		if (rustRange.getFrom() != null) {
			rustRange.getFrom().accept(this);
		}
		out.write(rustRange.getOperator());
		if (rustRange.getTo() != null) {
			rustRange.getTo().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(RustBlockExpression rustBlockExpression) throws IOException {
		writeLabel(rustBlockExpression.getLabel());
		for (String modifier : rustBlockExpression.getModifiers()) {
			out.write(modifier);
			out.write(" ");
		}
		rustBlockExpression.getBlock().accept(nodes);
		return null;
	}

	@Override
	public Void visit(RustIf rustIf) throws IOException {
		out.write("if ");
		rustIf.getCondition().accept(this);
		out.write(" ");
		rustIf.getThenBlock().accept(nodes);
		if (rustIf.getElseBranch() != null) {
			out.write(" else ");
			rustIf.getElseBranch().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(RustLetCondition rustLetCondition) throws IOException {
		out.write("let ");
		rustLetCondition.getPattern().accept(nodes);
		out.write(" = ");
		rustLetCondition.getExpression().accept(this);
		return null;
	}

	@Override
	public Void visit(RustMatch rustMatch) throws IOException {
		out.write("match ");
		rustMatch.getScrutinee().accept(this);
		if (rustMatch.getArms().isEmpty()) {
			out.write(" {}");
			return null;
		}
		out.write(" {");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (RustMatchArm arm : rustMatch.getArms()) {
				out.newLine();
				arm.accept(nodes);
			}
		}
		out.newLine();
		out.write("}");
		return null;
	}

	@Override
	public Void visit(RustWhile rustWhile) throws IOException {
		writeLabel(rustWhile.getLabel());
		out.write("while ");
		rustWhile.getCondition().accept(this);
		writeLoopBody(rustWhile.getSpecClauses(), rustWhile.getBody());
		return null;
	}

	@Override
	public Void visit(RustLoop rustLoop) throws IOException {
		writeLabel(rustLoop.getLabel());
		out.write("loop");
		writeLoopBody(rustLoop.getSpecClauses(), rustLoop.getBody());
		return null;
	}

	@Override
	public Void visit(RustFor rustFor) throws IOException {
		writeLabel(rustFor.getLabel());
		out.write("for ");
		rustFor.getPattern().accept(nodes);
		out.write(" in ");
		if (rustFor.getIteratorName() != null) {
			out.write(rustFor.getIteratorName());
			out.write(": ");
		}
		rustFor.getIterable().accept(this);
		writeLoopBody(rustFor.getSpecClauses(), rustFor.getBody());
		return null;
	}

	@Override
	public Void visit(RustBreak rustBreak) throws IOException {
		out.write("break");
		if (rustBreak.getLabel() != null) {
			out.write(" ");
			out.write(rustBreak.getLabel());
		}
		if (rustBreak.getValue() != null) {
			out.write(" ");
			rustBreak.getValue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(RustContinue rustContinue) throws IOException {
		out.write("continue");
		if (rustContinue.getLabel() != null) {
			out.write(" ");
			out.write(rustContinue.getLabel());
		}
		return null;
	}

	@Override
	public Void visit(RustReturn rustReturn) throws IOException {
		out.write("return");
		if (rustReturn.getValue() != null) {
			out.write(" ");
			rustReturn.getValue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(RustClosure rustClosure) throws IOException {
		for (String modifier : rustClosure.getModifiers()) {
			out.write(modifier);
			out.write(" ");
		}
		writeQuantifierParams(rustClosure.getParams());
		if (rustClosure.getReturnType() != null) {
			out.write(" ");
			rustClosure.getReturnType().accept(nodes);
		}
		for (RustSpecClause clause : rustClosure.getSpecClauses()) {
			out.write(" ");
			clause.accept(nodes);
		}
		out.write(" ");
		rustClosure.getBody().accept(this);
		return null;
	}

	@Override
	public Void visit(RustMacroCall rustMacroCall) throws IOException {
		rustMacroCall.getPath().accept(nodes);
		out.write("!");
		RustMacroDelimiter delimiter = rustMacroCall.getDelimiter();
		if (delimiter == RustMacroDelimiter.BRACE) {
			out.write(" ");
		}
		out.write(delimiter.getOpen());
		FormattingTools.writeTokens(out, rustMacroCall.getTokens());
		out.write(delimiter.getClose());
		return null;
	}

	@Override
	public Void visit(RustQuantifier rustQuantifier) throws IOException {
		out.write(rustQuantifier.getQuantifier());
		writeQuantifierParams(rustQuantifier.getParams());
		out.write(" ");
		rustQuantifier.getBody().accept(this);
		return null;
	}

	@Override
	public Void visit(RustAssert rustAssert) throws IOException {
		out.write("assert(");
		rustAssert.getCondition().accept(this);
		out.write(")");
		if (rustAssert.getStrategy() != null) {
			out.write(" by(");
			out.write(rustAssert.getStrategy());
			out.write(")");
		}
		for (RustSpecClause clause : rustAssert.getRequires()) {
			out.write(" ");
			clause.accept(nodes);
		}
		if (rustAssert.getProof() != null) {
			out.write(rustAssert.getStrategy() == null ? " by " : " ");
			rustAssert.getProof().accept(nodes);
		}
		return null;
	}

	@Override
	public Void visit(RustAssume rustAssume) throws IOException {
		out.write("assume(");
		rustAssume.getCondition().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(RustAssertForall rustAssertForall) throws IOException {
		out.write("assert forall");
		writeQuantifierParams(rustAssertForall.getParams());
		out.write(" ");
		rustAssertForall.getCondition().accept(this);
		if (rustAssertForall.getImplies() != null) {
			out.write(" implies ");
			rustAssertForall.getImplies().accept(this);
		}
		if (rustAssertForall.getProof() != null) {
			out.write(" by ");
			rustAssertForall.getProof().accept(nodes);
		}
		return null;
	}

	@Override
	public Void visit(RustProofBlock rustProofBlock) throws IOException {
		out.write("proof ");
		rustProofBlock.getBlock().accept(nodes);
		return null;
	}

	@Override
	public Void visit(RustBigOperator rustBigOperator) throws IOException {
		for (int i = 0; i < rustBigOperator.getOperands().size(); i++) {
			if (i != 0) {
				out.write(" ");
			}
			out.write(rustBigOperator.getOperator());
			out.write(" ");
			rustBigOperator.getOperands().get(i).accept(this);
		}
		return null;
	}

}
