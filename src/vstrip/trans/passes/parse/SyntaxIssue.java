package vstrip.trans.passes.parse;

import vstrip.errors.Issue;
import vstrip.errors.IssueVisitor;
import vstrip.util.SourceLocation;

/**
 * Malformed input: an unmatched wrapper, a token the lexer cannot read or a
 * token sequence the parser cannot make sense of.
 */
public class SyntaxIssue extends Issue {
	private static final long serialVersionUID = 2190745003446133627L;

	private final SourceLocation location;
	private final String description;

	public SyntaxIssue(SourceLocation location, String description) {
		this.location = location;
		this.description = description;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getDescription() {
		return description;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
