package notasyn.trans.passes.parse.option;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;

public class OptionParserIssue extends Issue {
	private final String description;

	public OptionParserIssue(String description) {
		this.description = description;
	}

	public String getDescription() {
		return description;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
