package notasyn.trans.passes.compat;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.model.notation.NotationKey;

public class NoSyntaxRuleIssue extends Issue {

	private final NotationKey key;

	public NoSyntaxRuleIssue(NotationKey key) {
		this.key = key;
	}

	public NotationKey getKey() {
		return key;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
