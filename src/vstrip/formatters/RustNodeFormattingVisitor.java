package vstrip.formatters;

import vstrip.lexer.RustToken;
import vstrip.model.rust.*;

import java.io.IOException;
import java.util.List;

/**
 * Prints syntax tree nodes as Rust text in the canonical layout: four space
 * indentation, one item or statement per line, blocks always broken over
 * several lines and no blank lines.
 */
public class RustNodeFormattingVisitor extends RustNodeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public RustNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	void writeAttributes(List<RustAttribute> attributes) throws IOException {
		for (RustAttribute attribute : attributes) {
			attribute.accept(this);
			out.newLine();
		}
	}

	void writeInlineAttributes(List<RustAttribute> attributes) throws IOException {
		for (RustAttribute attribute : attributes) {
			attribute.accept(this);
			if (attribute.isDocComment()) {
				out.newLine();
			} else {
				out.write(" ");
			}
		}
	}

	void writeVisibility(String visibility) throws IOException {
		if (!visibility.isEmpty()) {
			out.write(visibility);
			out.write(" ");
		}
	}

	void writeMode(RustDataMode mode) throws IOException {
		switch (mode) {
			case DEFAULT:
				break;
			case GHOST:
				out.write("ghost ");
				break;
			case TRACKED:
				out.write("tracked ");
				break;
		}
	}

	void writeGenerics(List<RustGenericParam> generics) throws IOException {
		if (!generics.isEmpty()) {
			out.write("<");
			FormattingTools.writeCommaSeparated(out, generics, p -> p.accept(this));
			out.write(">");
		}
	}

	void writeBounds(List<RustBound> bounds) throws IOException {
		FormattingTools.writeSeparated(out, bounds, " + ", b -> b.accept(this));
	}

	void writeForLifetimes(List<String> lifetimes) throws IOException {
		if (!lifetimes.isEmpty()) {
			out.write("for<");
			out.write(String.join(", ", lifetimes));
			out.write("> ");
		}
	}

	/**
	 * Writes the where clause and the verification clauses that follow a
	 * signature, each on its own line.
	 *
	 * @return whether anything was written, in which case the body has to start
	 * on a fresh line
	 */
	boolean writeSignatureTrailer(List<RustWherePredicate> whereClause, List<RustSpecClause> specClauses)
			throws IOException {
		if (whereClause.isEmpty() && specClauses.isEmpty()) {
			return false;
		}
		if (!whereClause.isEmpty()) {
			out.newLine();
			out.write("where");
			try (IndentingWriter.Indent ignored = out.indent()) {
				for (RustWherePredicate predicate : whereClause) {
					out.newLine();
					predicate.accept(this);
					out.write(",");
				}
			}
		}
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (RustSpecClause clause : specClauses) {
				out.newLine();
				clause.accept(this);
			}
		}
		out.newLine();
		return true;
	}

	void writeBody(RustBlock body, boolean onFreshLine) throws IOException {
		if (!onFreshLine) {
			out.write(" ");
		}
		body.accept(this);
	}

	void writeFields(RustFieldsStyle style, List<RustField> fields, boolean multiLine) throws IOException {
		switch (style) {
			case UNIT:
				break;
			case TUPLE:
				out.write("(");
				FormattingTools.writeCommaSeparated(out, fields, f -> f.accept(this));
				out.write(")");
				break;
			case NAMED:
				if (fields.isEmpty()) {
					out.write("{}");
				} else if (multiLine) {
					out.write("{");
					try (IndentingWriter.Indent ignored = out.indent()) {
						for (RustField field : fields) {
							out.newLine();
							field.accept(this);
							out.write(",");
						}
					}
					out.newLine();
					out.write("}");
				} else {
					out.write("{ ");
					FormattingTools.writeCommaSeparated(out, fields, f -> f.accept(this));
					out.write(" }");
				}
				break;
		}
	}

	@Override
	public Void visit(RustItem item) throws IOException {
		item.accept(new RustItemFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(RustStatement statement) throws IOException {
		statement.accept(new RustStatementFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(RustExpression expression) throws IOException {
		expression.accept(new RustExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(RustPattern pattern) throws IOException {
		pattern.accept(new RustPatternFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(RustType type) throws IOException {
		type.accept(new RustTypeFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(RustSourceUnit rustSourceUnit) throws IOException {
		writeAttributes(rustSourceUnit.getInnerAttributes());
		for (RustItem item : rustSourceUnit.getItems()) {
			item.accept(this);
			out.newLine();
		}
		return null;
	}

	@Override
	public Void visit(RustAttribute rustAttribute) throws IOException {
		if (rustAttribute.isDocComment()) {
			out.writeVerbatim(rustAttribute.getDocComment());
			return null;
		}
		out.write(rustAttribute.isInner() ? "#![" : "#[");
		out.write(rustAttribute.getPath());
		List<RustToken> arguments = rustAttribute.getArguments();
		if (!arguments.isEmpty()) {
			if (arguments.get(0).isPunct("=")) {
				out.write(" ");
			}
			FormattingTools.writeTokens(out, arguments);
		}
		out.write("]");
		return null;
	}

	@Override
	public Void visit(RustParam rustParam) throws IOException {
		writeInlineAttributes(rustParam.getAttributes());
		writeMode(rustParam.getMode());
		if (rustParam.getReceiver() != null) {
			out.write(rustParam.getReceiver());
			return null;
		}
		rustParam.getPattern().accept(this);
		if (rustParam.getType() != null) {
			out.write(": ");
			rustParam.getType().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(RustField rustField) throws IOException {
		writeInlineAttributes(rustField.getAttributes());
		writeVisibility(rustField.getVisibility());
		writeMode(rustField.getMode());
		if (rustField.getName() != null) {
			out.write(rustField.getName());
			out.write(": ");
		}
		rustField.getType().accept(this);
		return null;
	}

	@Override
	public Void visit(RustVariant rustVariant) throws IOException {
		writeAttributes(rustVariant.getAttributes());
		out.write(rustVariant.getName());
		if (rustVariant.getStyle() == RustFieldsStyle.NAMED) {
			out.write(" ");
		}
		writeFields(rustVariant.getStyle(), rustVariant.getFields(), false);
		if (rustVariant.getDiscriminant() != null) {
			out.write(" = ");
			rustVariant.getDiscriminant().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(RustSpecClause rustSpecClause) throws IOException {
		out.write(rustSpecClause.getKeyword());
		if (!rustSpecClause.getExpressions().isEmpty()) {
			out.write(" ");
			FormattingTools.writeCommaSeparated(out, rustSpecClause.getExpressions(), e -> e.accept(this));
		}
		return null;
	}

	@Override
	public Void visit(RustReturnType rustReturnType) throws IOException {
		out.write("-> ");
		if (rustReturnType.getName() == null) {
			writeMode(rustReturnType.getMode());
			rustReturnType.getType().accept(this);
		} else {
			out.write("(");
			writeMode(rustReturnType.getMode());
			out.write(rustReturnType.getName());
			out.write(": ");
			rustReturnType.getType().accept(this);
			out.write(")");
		}
		return null;
	}

	@Override
	public Void visit(RustBlock rustBlock) throws IOException {
		if (rustBlock.getStatements().isEmpty()) {
			out.write("{}");
			return null;
		}
		out.write("{");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (RustStatement statement : rustBlock.getStatements()) {
				out.newLine();
				statement.accept(this);
			}
		}
		out.newLine();
		out.write("}");
		return null;
	}

	@Override
	public Void visit(RustMatchArm rustMatchArm) throws IOException {
		writeAttributes(rustMatchArm.getAttributes());
		rustMatchArm.getPattern().accept(this);
		if (rustMatchArm.getGuard() != null) {
			out.write(" if ");
			rustMatchArm.getGuard().accept(this);
		}
		out.write(" => ");
		RustExpression body = rustMatchArm.getBody();
		body.accept(this);
		boolean plainBlock = body instanceof RustBlockExpression &&
				((RustBlockExpression) body).getLabel() == null &&
				((RustBlockExpression) body).getModifiers().isEmpty();
		if (!plainBlock) {
			out.write(",");
		}
		return null;
	}

	@Override
	public Void visit(RustGenericParam rustGenericParam) throws IOException {
		writeInlineAttributes(rustGenericParam.getAttributes());
		switch (rustGenericParam.getKind()) {
			case LIFETIME:
			case TYPE:
				out.write(rustGenericParam.getName());
				if (!rustGenericParam.getBounds().isEmpty()) {
					out.write(": ");
					writeBounds(rustGenericParam.getBounds());
				}
				if (rustGenericParam.getDefaultType() != null) {
					out.write(" = ");
					rustGenericParam.getDefaultType().accept(this);
				}
				break;
			case CONST:
				out.write("const ");
				out.write(rustGenericParam.getName());
				out.write(": ");
				rustGenericParam.getType().accept(this);
				if (rustGenericParam.getDefaultValue() != null) {
					out.write(" = ");
					rustGenericParam.getDefaultValue().accept(this);
				}
				break;
		}
		return null;
	}

	@Override
	public Void visit(RustWherePredicate rustWherePredicate) throws IOException {
		writeForLifetimes(rustWherePredicate.getForLifetimes());
		if (rustWherePredicate.getBoundedLifetime() != null) {
			out.write(rustWherePredicate.getBoundedLifetime());
		} else {
			rustWherePredicate.getBoundedType().accept(this);
		}
		out.write(":");
		if (!rustWherePredicate.getBounds().isEmpty()) {
			out.write(" ");
			writeBounds(rustWherePredicate.getBounds());
		}
		return null;
	}

	@Override
	public Void visit(RustBound rustBound) throws IOException {
		if (rustBound.getLifetime() != null) {
			out.write(rustBound.getLifetime());
			return null;
		}
		if (rustBound.isMaybe()) {
			out.write("?");
		}
		writeForLifetimes(rustBound.getForLifetimes());
		rustBound.getPath().accept(this);
		return null;
	}

	@Override
	public Void visit(RustPath rustPath) throws IOException {
		if (rustPath.getQualifiedSelf() != null) {
			out.write("<");
			rustPath.getQualifiedSelf().accept(this);
			if (rustPath.getQualifiedTrait() != null) {
				out.write(" as ");
				rustPath.getQualifiedTrait().accept(this);
			}
			out.write(">::");
		} else if (rustPath.isGlobal()) {
			out.write("::");
		}
		FormattingTools.writeSeparated(out, rustPath.getSegments(), "::", s -> s.accept(this));
		return null;
	}

	@Override
	public Void visit(RustPathSegment rustPathSegment) throws IOException {
		out.write(rustPathSegment.getName());
		if (rustPathSegment.getArguments() != null) {
			if (rustPathSegment.isTurbofish()) {
				out.write("::");
			}
			rustPathSegment.getArguments().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(RustGenericArgs rustGenericArgs) throws IOException {
		if (rustGenericArgs.isParenthesized()) {
			out.write("(");
			FormattingTools.writeCommaSeparated(out, rustGenericArgs.getArguments(), a -> a.accept(this));
			out.write(")");
			if (rustGenericArgs.getOutput() != null) {
				out.write(" -> ");
				rustGenericArgs.getOutput().accept(this);
			}
		} else {
			out.write("<");
			FormattingTools.writeCommaSeparated(out, rustGenericArgs.getArguments(), a -> a.accept(this));
			out.write(">");
		}
		return null;
	}

	@Override
	public Void visit(RustGenericArg rustGenericArg) throws IOException {
		switch (rustGenericArg.getKind()) {
			case LIFETIME:
				out.write(rustGenericArg.getLifetime());
				break;
			case TYPE:
				rustGenericArg.getType().accept(this);
				break;
			case CONST:
				rustGenericArg.getValue().accept(this);
				break;
			case BINDING:
				out.write(rustGenericArg.getName());
				out.write(" = ");
				rustGenericArg.getType().accept(this);
				break;
			case CONSTRAINT:
				out.write(rustGenericArg.getName());
				out.write(": ");
				writeBounds(rustGenericArg.getBounds());
				break;
		}
		return null;
	}

	@Override
	public Void visit(RustFieldInit rustFieldInit) throws IOException {
		out.write(rustFieldInit.getName());
		if (rustFieldInit.getValue() != null) {
			out.write(": ");
			rustFieldInit.getValue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(RustFieldPattern rustFieldPattern) throws IOException {
		if (!rustFieldPattern.isShorthand()) {
			out.write(rustFieldPattern.getName());
			out.write(": ");
		}
		rustFieldPattern.getPattern().accept(this);
		return null;
	}

	@Override
	public Void visit(RustUseTree rustUseTree) throws IOException {
		switch (rustUseTree.getKind()) {
			case PATH:
				out.write(rustUseTree.getName());
				out.write("::");
				rustUseTree.getChild().accept(this);
				break;
			case NAME:
				out.write(rustUseTree.getName());
				if (rustUseTree.getRename() != null) {
					out.write(" as ");
					out.write(rustUseTree.getRename());
				}
				break;
			case GLOB:
				out.write("*");
				break;
			case GROUP:
				out.write("{");
				FormattingTools.writeCommaSeparated(out, rustUseTree.getGroup(), t -> t.accept(this));
				out.write("}");
				break;
		}
		return null;
	}

}
