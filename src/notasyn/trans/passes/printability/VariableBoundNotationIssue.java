package notasyn.trans.passes.printability;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.util.SourceLocation;

public class VariableBoundNotationIssue extends Issue {

	private final String variable;
	private final SourceLocation location;

	public VariableBoundNotationIssue(String variable, SourceLocation location) {
		this.variable = variable;
		this.location = location;
	}

	public String getVariable() {
		return variable;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
