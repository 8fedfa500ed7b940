package notasyn.trans.passes.compat;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;

public class CustomEntryExistsIssue extends Issue {

	private final String name;

	public CustomEntryExistsIssue(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
