package notasyn.trans.passes.grammar;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.util.SourceLocation;

public class NonProductiveRuleIssue extends Issue {

	public enum Reason {
		NO_SYMBOL,
		STARTS_WITH_RECURSIVE_LIST,
		NON_TERMINAL_IN_SEPARATOR,
		OPEN_BINDER_WITH_SEPARATOR,
		INVALID_RECURSIVE_COMPONENT,
	}

	private final Reason reason;
	private final SourceLocation location;

	public NonProductiveRuleIssue(Reason reason, SourceLocation location) {
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
