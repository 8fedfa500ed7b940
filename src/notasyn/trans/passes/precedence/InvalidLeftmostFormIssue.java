package notasyn.trans.passes.precedence;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.util.SourceLocation;

public class InvalidLeftmostFormIssue extends Issue {

	public enum Reason {
		LEVEL_CANNOT_CHANGE,
		ATOMIC_NOT_AT_LEVEL_ZERO,
		BINDER_OR_PATTERN,
	}

	private final String variable;
	private final Reason reason;
	private final SourceLocation location;

	public InvalidLeftmostFormIssue(String variable, Reason reason, SourceLocation location) {
		this.variable = variable;
		this.reason = reason;
		this.location = location;
	}

	public String getVariable() {
		return variable;
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
