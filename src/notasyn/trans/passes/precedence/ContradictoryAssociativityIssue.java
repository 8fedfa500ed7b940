package notasyn.trans.passes.precedence;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.util.SourceLocation;

public class ContradictoryAssociativityIssue extends Issue {
	private final SourceLocation location;

	public ContradictoryAssociativityIssue(SourceLocation location) {
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
