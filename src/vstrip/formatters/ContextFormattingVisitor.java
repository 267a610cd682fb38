package vstrip.formatters;

import vstrip.errors.ContextVisitor;
import vstrip.errors.FileContext;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(FileContext fileContext) throws IOException {
		out.write("while processing ");
		out.write(String.valueOf(fileContext.getFile()));
		return null;
	}
}
