package notasyn.trans.passes.printability;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.util.SourceLocation;

public class UnusedInterpretationIssue extends Issue {

	private final boolean withSyntax;
	private final SourceLocation location;

	/**
	 * @param withSyntax whether the declaration also declared syntax, in which case it could be a
	 *                   reserved notation instead
	 */
	public UnusedInterpretationIssue(boolean withSyntax, SourceLocation location) {
		this.withSyntax = withSyntax;
		this.location = location;
	}

	public boolean isWithSyntax() {
		return withSyntax;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
