package notasyn.trans.passes.compat;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;

/**
 * Raised as a warning; the scope gets declared.
 */
public class UndeclaredScopeIssue extends Issue {

	private final String scope;

	public UndeclaredScopeIssue(String scope) {
		this.scope = scope;
	}

	public String getScope() {
		return scope;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
