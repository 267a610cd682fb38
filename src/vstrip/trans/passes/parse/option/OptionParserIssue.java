package vstrip.trans.passes.parse.option;

import vstrip.errors.Issue;
import vstrip.errors.IssueVisitor;

public class OptionParserIssue extends Issue {
	private static final long serialVersionUID = -5102476532291049163L;

	private final String description;

	public OptionParserIssue(String description) {
		this.description = description;
	}

	public String getDescription() {
		return description;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
