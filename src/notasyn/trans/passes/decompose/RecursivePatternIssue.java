package notasyn.trans.passes.decompose;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.util.SourceLocation;

public class RecursivePatternIssue extends Issue {

	public enum Reason {
		UNQUOTED_UNDERSCORE,
		NO_VARIABLE_BEFORE_ELLIPSIS,
		ONE_SIDED_TOKEN,
		ONE_SIDED_BREAK,
		EXPECTED_RECURSIVE_FORM,
	}

	private final Reason reason;
	private final SourceLocation location;

	public RecursivePatternIssue(Reason reason, SourceLocation location) {
		this.reason = reason;
		this.location = location;
	}

	public Reason getReason() {
		return reason;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
