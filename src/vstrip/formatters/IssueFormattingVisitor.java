package vstrip.formatters;

import vstrip.errors.IssueVisitor;
import vstrip.errors.IssueWithContext;
import vstrip.trans.batch.IOErrorIssue;
import vstrip.trans.passes.classify.UnsupportedConstructIssue;
import vstrip.trans.passes.parse.SyntaxIssue;
import vstrip.trans.passes.parse.option.OptionParserIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getDescription());
		return null;
	}

	@Override
	public Void visit(SyntaxIssue syntaxIssue) throws IOException {
		out.write("syntax error: ");
		out.write(syntaxIssue.getDescription());
		if (!syntaxIssue.getLocation().isUnknown()) {
			out.write(" ");
			syntaxIssue.getLocation().writePretty(out);
		}
		return null;
	}

	@Override
	public Void visit(UnsupportedConstructIssue unsupportedConstructIssue) throws IOException {
		out.write("unsupported construct: ");
		out.write(unsupportedConstructIssue.getDescription());
		if (!unsupportedConstructIssue.getLocation().isUnknown()) {
			out.write(" ");
			unsupportedConstructIssue.getLocation().writePretty(out);
		}
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error on ");
		out.write(String.valueOf(ioErrorIssue.getPath()));
		out.write(": ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

}
