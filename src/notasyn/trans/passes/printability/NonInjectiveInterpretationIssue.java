package notasyn.trans.passes.printability;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.util.SourceLocation;

import java.util.List;

public class NonInjectiveInterpretationIssue extends Issue {

	private final List<String> missingVariables;
	private final SourceLocation location;

	public NonInjectiveInterpretationIssue(List<String> missingVariables, SourceLocation location) {
		this.missingVariables = missingVariables;
		this.location = location;
	}

	public List<String> getMissingVariables() {
		return missingVariables;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
