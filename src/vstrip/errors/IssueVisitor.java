package vstrip.errors;

import vstrip.trans.batch.IOErrorIssue;
import vstrip.trans.passes.classify.UnsupportedConstructIssue;
import vstrip.trans.passes.parse.SyntaxIssue;
import vstrip.trans.passes.parse.option.OptionParserIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(SyntaxIssue syntaxIssue) throws E;
	public abstract T visit(UnsupportedConstructIssue unsupportedConstructIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
}
