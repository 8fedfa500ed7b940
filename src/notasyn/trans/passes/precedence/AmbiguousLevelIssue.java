package notasyn.trans.passes.precedence;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.util.SourceLocation;

public class AmbiguousLevelIssue extends Issue {

	public enum Reason {
		LEFT_RECURSIVE,
		LEFTMOST_NEEDS_LEVEL,
		ONLY_PRINTING_LEFTMOST,
		UNDETERMINED,
	}

	private final Reason reason;
	private final SourceLocation location;

	public AmbiguousLevelIssue(Reason reason, SourceLocation location) {
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
