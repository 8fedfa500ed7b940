package notasyn.trans.passes.unparsing;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.util.SourceLocation;

/**
 * A format was given to a notation that is only used for parsing.
 */
public class IgnoredFormatIssue extends Issue {
	private final SourceLocation location;

	public IgnoredFormatIssue(SourceLocation location) {
		this.location = location;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
