package notasyn.trans.passes.unparsing;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.util.SourceLocation;

public class FormatMismatchIssue extends Issue {

	public enum Reason {
		UNTERMINATED_BOX,
		UNCLOSED_QUOTE,
		EMPTY_QUOTED_TOKEN,
		SPACE_IN_QUOTE,
		LONE_QUOTE,
		TRAILING_SPACES,
		UNOPENED_BOX,
		MISSING_BOX_INDENT,
		INVALID_INDENT,
		UNQUOTED_TOKEN,
		STRUCTURE,
		ELLIPSIS_DEPTH,
		ELLIPSIS_SIDES,
	}

	private final Reason reason;
	private final SourceLocation location;

	public FormatMismatchIssue(Reason reason, SourceLocation location) {
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
