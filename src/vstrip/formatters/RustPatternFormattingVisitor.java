package vstrip.formatters;

import vstrip.model.rust.*;

import java.io.IOException;

public class RustPatternFormattingVisitor extends RustPatternVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final RustNodeFormattingVisitor nodes;

	public RustPatternFormattingVisitor(IndentingWriter out) {
		this.out = out;
		this.nodes = new RustNodeFormattingVisitor(out);
	}

	@Override
	public Void visit(RustIdentPattern rustIdentPattern) throws IOException {
		if (rustIdentPattern.isByRef()) {
			out.write("ref ");
		}
		if (rustIdentPattern.isMutable()) {
			out.write("mut ");
		}
		out.write(rustIdentPattern.getName());
		if (rustIdentPattern.getSubpattern() != null) {
			out.write(" @ ");
			rustIdentPattern.getSubpattern().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(RustWildcardPattern rustWildcardPattern) throws IOException {
		out.write("_");
		return null;
	}

	@Override
	public Void visit(RustRestPattern rustRestPattern) throws IOException {
		out.write("..");
		return null;
	}

	@Override
	public Void visit(RustLiteralPattern rustLiteralPattern) throws IOException {
		out.writeVerbatim(rustLiteralPattern.getValue());
		return null;
	}

	@Override
	public Void visit(RustRangePattern rustRangePattern) throws IOException {
		if (rustRangePattern.getLower() != null) {
			rustRangePattern.getLower().accept(this);
		}
		out.write(rustRangePattern.getOperator());
		if (rustRangePattern.getUpper() != null) {
			rustRangePattern.getUpper().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(RustPathPattern rustPathPattern) throws IOException {
		rustPathPattern.getPath().accept(nodes);
		return null;
	}

	@Override
	public Void visit(RustTupleStructPattern rustTupleStructPattern) throws IOException {
		rustTupleStructPattern.getPath().accept(nodes);
		out.write("(");
		FormattingTools.writeCommaSeparated(out, rustTupleStructPattern.getElements(), p -> p.accept(this));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(RustStructPattern rustStructPattern) throws IOException {
		rustStructPattern.getPath().accept(nodes);
		if (rustStructPattern.getFields().isEmpty() && !rustStructPattern.isRest()) {
			out.write(" {}");
			return null;
		}
		out.write(" { ");
		FormattingTools.writeCommaSeparated(out, rustStructPattern.getFields(), f -> f.accept(nodes));
		if (rustStructPattern.isRest()) {
			if (!rustStructPattern.getFields().isEmpty()) {
				out.write(", ");
			}
			out.write("..");
		}
		out.write(" }");
		return null;
	}

	@Override
	public Void visit(RustTuplePattern rustTuplePattern) throws IOException {
		out.write("(");
		FormattingTools.writeCommaSeparated(out, rustTuplePattern.getElements(), p -> p.accept(this));
		if (rustTuplePattern.getElements().size() == 1 &&
				!(rustTuplePattern.getElements().get(0) instanceof RustRestPattern)) {
			out.write(",");
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(RustParenthesizedPattern rustParenthesizedPattern) throws IOException {
		out.write("(");
		rustParenthesizedPattern.getPattern().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(RustSlicePattern rustSlicePattern) throws IOException {
		out.write("[");
		FormattingTools.writeCommaSeparated(out, rustSlicePattern.getElements(), p -> p.accept(this));
		out.write("]");
		return null;
	}

	@Override
	public Void visit(RustReferencePattern rustReferencePattern) throws IOException {
		out.write(rustReferencePattern.isMutable() ? "&mut " : "&");
		rustReferencePattern.getPattern().accept(this);
		return null;
	}

	@Override
	public Void visit(RustOrPattern rustOrPattern) throws IOException {
		FormattingTools.writeSeparated(out, rustOrPattern.getAlternatives(), " | ", p -> p.accept(this));
		return null;
	}

}
