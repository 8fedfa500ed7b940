package notasyn.trans.passes.decompose;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.util.SourceLocation;

/**
 * A pattern contains "{ x }" while the notation "{ x }" has no grammar rule to parse the braces.
 */
public class CurlyBracketsIssue extends Issue {

	private final SourceLocation location;

	public CurlyBracketsIssue(SourceLocation location) {
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
