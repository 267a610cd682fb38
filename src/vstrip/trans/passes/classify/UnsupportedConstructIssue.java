package vstrip.trans.passes.classify;

import vstrip.errors.Issue;
import vstrip.errors.IssueVisitor;
import vstrip.util.SourceLocation;

/**
 * A dialect construct that is recognised but cannot be stripped safely, so
 * the file is rejected instead of being passed through.
 */
public class UnsupportedConstructIssue extends Issue {
	private static final long serialVersionUID = -3807216554928893313L;

	private final SourceLocation location;
	private final String description;

	public UnsupportedConstructIssue(SourceLocation location, String description) {
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
