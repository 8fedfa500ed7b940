package notasyn.trans.passes.unparsing;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.util.SourceLocation;

/**
 * Extra blanks in a pattern that also has an explicit format do not affect printing.
 */
public class DiscardedNotationBreakIssue extends Issue {
	private final SourceLocation location;

	public DiscardedNotationBreakIssue(SourceLocation location) {
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
