package vstrip.formatters;

import vstrip.model.rust.*;

import java.io.IOException;

public class RustTypeFormattingVisitor extends RustTypeVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final RustNodeFormattingVisitor nodes;

	public RustTypeFormattingVisitor(IndentingWriter out) {
		this.out = out;
		this.nodes = new RustNodeFormattingVisitor(out);
	}

	@Override
	public Void visit(RustPathType rustPathType) throws IOException {
		rustPathType.getPath().accept(nodes);
		return null;
	}

	@Override
	public Void visit(RustReferenceType rustReferenceType) throws IOException {
		out.write("&");
		if (rustReferenceType.getLifetime() != null) {
			out.write(rustReferenceType.getLifetime());
			out.write(" ");
		}
		if (rustReferenceType.isMutable()) {
			out.write("mut ");
		}
		rustReferenceType.getType().accept(this);
		return null;
	}

	@Override
	public Void visit(RustPointerType rustPointerType) throws IOException {
		out.write(rustPointerType.isMutable() ? "*mut " : "*const ");
		rustPointerType.getType().accept(this);
		return null;
	}

	@Override
	public Void visit(RustTupleType rustTupleType) throws IOException {
		out.write("(");
		FormattingTools.writeCommaSeparated(out, rustTupleType.getElements(), t -> t.accept(this));
		if (rustTupleType.getElements().size() == 1) {
			out.write(",");
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(RustParenthesizedType rustParenthesizedType) throws IOException {
		out.write("(");
		rustParenthesizedType.getType().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(RustSliceType rustSliceType) throws IOException {
		out.write("[");
		rustSliceType.getType().accept(this);
		out.write("]");
		return null;
	}

	@Override
	public Void visit(RustArrayType rustArrayType) throws IOException {
		out.write("[");
		rustArrayType.getType().accept(this);
		out.write("; ");
		rustArrayType.getLength().accept(nodes);
		out.write("]");
		return null;
	}

	@Override
	public Void visit(RustFunctionPointerType rustFunctionPointerType) throws IOException {
		nodes.writeForLifetimes(rustFunctionPointerType.getForLifetimes());
		for (String qualifier : rustFunctionPointerType.getQualifiers()) {
			out.write(qualifier);
			out.write(" ");
		}
		out.write("fn(");
		FormattingTools.writeCommaSeparated(out, rustFunctionPointerType.getParams(), t -> t.accept(this));
		out.write(")");
		if (rustFunctionPointerType.getReturnType() != null) {
			out.write(" -> ");
			rustFunctionPointerType.getReturnType().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(RustTraitObjectType rustTraitObjectType) throws IOException {
		if (!rustTraitObjectType.getKeyword().isEmpty()) {
			out.write(rustTraitObjectType.getKeyword());
			out.write(" ");
		}
		nodes.writeBounds(rustTraitObjectType.getBounds());
		return null;
	}

	@Override
	public Void visit(RustNeverType rustNeverType) throws IOException {
		out.write("!");
		return null;
	}

	@Override
	public Void visit(RustInferType rustInferType) throws IOException {
		out.write("_");
		return null;
	}

}
