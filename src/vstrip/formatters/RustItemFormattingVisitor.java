package vstrip.formatters;

import vstrip.model.rust.*;

import java.io.IOException;
import java.util.List;

public class RustItemFormattingVisitor extends RustItemVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final RustNodeFormattingVisitor nodes;

	public RustItemFormattingVisitor(IndentingWriter out) {
		this.out = out;
		this.nodes = new RustNodeFormattingVisitor(out);
	}

	private void writeHeader(RustItem item) throws IOException {
		nodes.writeAttributes(item.getAttributes());
		nodes.writeVisibility(item.getVisibility());
	}

	private void writeWords(List<String> words) throws IOException {
		for (String word : words) {
			out.write(word);
			out.write(" ");
		}
	}

	private void writeMembers(List<RustItem> items) throws IOException {
		if (items.isEmpty()) {
			out.write("{}");
			return;
		}
		out.write("{");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (RustItem item : items) {
				out.newLine();
				item.accept(this);
			}
		}
		out.newLine();
		out.write("}");
	}

	private void writeBraced(List<RustWherePredicate> whereClause, List<RustItem> items) throws IOException {
		boolean freshLine = nodes.writeSignatureTrailer(whereClause, List.of());
		if (!freshLine) {
			out.write(" ");
		}
		writeMembers(items);
	}

	@Override
	public Void visit(RustFunction rustFunction) throws IOException {
		writeHeader(rustFunction);
		writeWords(rustFunction.getModeQualifiers());
		if (rustFunction.getMode() != RustFunctionMode.DEFAULT) {
			out.write(rustFunction.getMode().getKeyword());
			out.write(" ");
		}
		writeWords(rustFunction.getQualifiers());
		out.write("fn ");
		out.write(rustFunction.getName());
		nodes.writeGenerics(rustFunction.getGenerics());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, rustFunction.getParams(), p -> p.accept(nodes));
		out.write(")");
		if (rustFunction.getReturnType() != null) {
			out.write(" ");
			rustFunction.getReturnType().accept(nodes);
		}
		if (rustFunction.getProofStrategy() != null) {
			out.write(" by (");
			out.write(rustFunction.getProofStrategy());
			out.write(")");
		}
		boolean freshLine = nodes.writeSignatureTrailer(rustFunction.getWhereClause(),
				rustFunction.getSpecClauses());
		if (rustFunction.getBody() == null) {
			out.write(";");
		} else {
			nodes.writeBody(rustFunction.getBody(), freshLine);
		}
		return null;
	}

	@Override
	public Void visit(RustStruct rustStruct) throws IOException {
		writeHeader(rustStruct);
		out.write("struct ");
		out.write(rustStruct.getName());
		nodes.writeGenerics(rustStruct.getGenerics());
		switch (rustStruct.getStyle()) {
			case NAMED: {
				boolean freshLine = nodes.writeSignatureTrailer(rustStruct.getWhereClause(), List.of());
				if (!freshLine) {
					out.write(" ");
				}
				nodes.writeFields(rustStruct.getStyle(), rustStruct.getFields(), true);
				break;
			}
			case TUPLE: {
				nodes.writeFields(rustStruct.getStyle(), rustStruct.getFields(), false);
				nodes.writeSignatureTrailer(rustStruct.getWhereClause(), List.of());
				out.write(";");
				break;
			}
			case UNIT: {
				nodes.writeSignatureTrailer(rustStruct.getWhereClause(), List.of());
				out.write(";");
				break;
			}
		}
		return null;
	}

	@Override
	public Void visit(RustEnum rustEnum) throws IOException {
		writeHeader(rustEnum);
		out.write("enum ");
		out.write(rustEnum.getName());
		nodes.writeGenerics(rustEnum.getGenerics());
		boolean freshLine = nodes.writeSignatureTrailer(rustEnum.getWhereClause(), List.of());
		if (!freshLine) {
			out.write(" ");
		}
		if (rustEnum.getVariants().isEmpty()) {
			out.write("{}");
			return null;
		}
		out.write("{");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (RustVariant variant : rustEnum.getVariants()) {
				out.newLine();
				variant.accept(nodes);
				out.write(",");
			}
		}
		out.newLine();
		out.write("}");
		return null;
	}

	@Override
	public Void visit(RustImpl rustImpl) throws IOException {
		writeHeader(rustImpl);
		if (rustImpl.isUnsafe()) {
			out.write("unsafe ");
		}
		out.write("impl");
		nodes.writeGenerics(rustImpl.getGenerics());
		out.write(" ");
		if (rustImpl.getTrait() != null) {
			if (rustImpl.isNegative()) {
				out.write("!");
			}
			rustImpl.getTrait().accept(nodes);
			out.write(" for ");
		}
		rustImpl.getSelfType().accept(nodes);
		writeBraced(rustImpl.getWhereClause(), rustImpl.getItems());
		return null;
	}

	@Override
	public Void visit(RustTrait rustTrait) throws IOException {
		writeHeader(rustTrait);
		if (rustTrait.isUnsafe()) {
			out.write("unsafe ");
		}
		if (rustTrait.isAuto()) {
			out.write("auto ");
		}
		out.write("trait ");
		out.write(rustTrait.getName());
		nodes.writeGenerics(rustTrait.getGenerics());
		if (!rustTrait.getSupertraits().isEmpty()) {
			out.write(": ");
			nodes.writeBounds(rustTrait.getSupertraits());
		}
		writeBraced(rustTrait.getWhereClause(), rustTrait.getItems());
		return null;
	}

	@Override
	public Void visit(RustConst rustConst) throws IOException {
		writeHeader(rustConst);
		writeWords(rustConst.getModeQualifiers());
		if (rustConst.getMode() != RustFunctionMode.DEFAULT) {
			out.write(rustConst.getMode().getKeyword());
			out.write(" ");
		}
		out.write(rustConst.getKeyword());
		out.write(" ");
		if (rustConst.isMutable()) {
			out.write("mut ");
		}
		out.write(rustConst.getName());
		out.write(": ");
		rustConst.getType().accept(nodes);
		if (rustConst.getValue() != null) {
			out.write(" = ");
			rustConst.getValue().accept(nodes);
		}
		out.write(";");
		return null;
	}

	@Override
	public Void visit(RustTypeAlias rustTypeAlias) throws IOException {
		writeHeader(rustTypeAlias);
		out.write("type ");
		out.write(rustTypeAlias.getName());
		nodes.writeGenerics(rustTypeAlias.getGenerics());
		if (!rustTypeAlias.getBounds().isEmpty()) {
			out.write(": ");
			nodes.writeBounds(rustTypeAlias.getBounds());
		}
		boolean freshLine = nodes.writeSignatureTrailer(rustTypeAlias.getWhereClause(), List.of());
		if (rustTypeAlias.getType() != null) {
			out.write(freshLine ? "= " : " = ");
			rustTypeAlias.getType().accept(nodes);
		}
		out.write(";");
		return null;
	}

	@Override
	public Void visit(RustModule rustModule) throws IOException {
		writeHeader(rustModule);
		if (rustModule.isUnsafe()) {
			out.write("unsafe ");
		}
		out.write("mod ");
		out.write(rustModule.getName());
		if (rustModule.getItems() == null) {
			out.write(";");
			return null;
		}
		out.write(" ");
		if (rustModule.getInnerAttributes().isEmpty() && rustModule.getItems().isEmpty()) {
			out.write("{}");
			return null;
		}
		out.write("{");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (RustAttribute attribute : rustModule.getInnerAttributes()) {
				out.newLine();
				attribute.accept(nodes);
			}
			for (RustItem item : rustModule.getItems()) {
				out.newLine();
				item.accept(this);
			}
		}
		out.newLine();
		out.write("}");
		return null;
	}

	@Override
	public Void visit(RustUse rustUse) throws IOException {
		writeHeader(rustUse);
		if (rustUse.isBroadcast()) {
			out.write("broadcast ");
		}
		out.write("use ");
		rustUse.getTree().accept(nodes);
		out.write(";");
		return null;
	}

	@Override
	public Void visit(RustMacroItem rustMacroItem) throws IOException {
		writeHeader(rustMacroItem);
		rustMacroItem.getPath().accept(nodes);
		out.write("!");
		if (rustMacroItem.getName() != null) {
			out.write(" ");
			out.write(rustMacroItem.getName());
			out.write(" ");
		}
		RustMacroDelimiter delimiter = rustMacroItem.getDelimiter();
		out.write(delimiter.getOpen());
		if (delimiter == RustMacroDelimiter.BRACE && !rustMacroItem.getTokens().isEmpty()) {
			out.write(" ");
			FormattingTools.writeTokens(out, rustMacroItem.getTokens());
			out.write(" ");
		} else {
			FormattingTools.writeTokens(out, rustMacroItem.getTokens());
		}
		out.write(delimiter.getClose());
		if (delimiter != RustMacroDelimiter.BRACE) {
			out.write(";");
		}
		return null;
	}

	@Override
	public Void visit(RustBroadcastGroup rustBroadcastGroup) throws IOException {
		writeHeader(rustBroadcastGroup);
		out.write("broadcast group ");
		out.write(rustBroadcastGroup.getName());
		out.write(" {");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (RustPath member : rustBroadcastGroup.getMembers()) {
				out.newLine();
				member.accept(nodes);
				out.write(",");
			}
		}
		out.newLine();
		out.write("}");
		return null;
	}

	@Override
	public Void visit(RustVerbatimItem rustVerbatimItem) throws IOException {
		writeHeader(rustVerbatimItem);
		FormattingTools.writeTokens(out, rustVerbatimItem.getTokens());
		return null;
	}

}
