package notasyn.trans.passes.compat;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.model.notation.NotationKey;

/**
 * Raised as a warning; the new printing rule replaces the previous one.
 */
public class IncompatibleFormatRedeclarationIssue extends Issue {

	private final NotationKey key;
	private final String scope;

	public IncompatibleFormatRedeclarationIssue(NotationKey key, String scope) {
		this.key = key;
		this.scope = scope;
	}

	public NotationKey getKey() {
		return key;
	}

	public String getScope() {
		return scope;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
