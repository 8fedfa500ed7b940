package notasyn.trans.passes.printability;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.util.SourceLocation;

public class OpaqueInterpretationIssue extends Issue {

	private final String description;
	private final SourceLocation location;

	public OpaqueInterpretationIssue(String description, SourceLocation location) {
		this.description = description;
		this.location = location;
	}

	public String getDescription() {
		return description;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
