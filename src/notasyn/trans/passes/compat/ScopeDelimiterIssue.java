package notasyn.trans.passes.compat;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;

/**
 * A change to the delimiting key of a scope. Overwriting a key or hiding another binding are
 * warnings; removing a key from a scope that has none is an error.
 */
public class ScopeDelimiterIssue extends Issue {

	public enum Reason {
		OVERWRITTEN_KEY,
		HIDDEN_BINDING,
		NO_KEY,
	}

	private final Reason reason;
	private final String scope;
	private final String key;
	private final String previous;

	/**
	 * @param previous the key the scope had before, or the scope the key was bound to before
	 */
	public ScopeDelimiterIssue(Reason reason, String scope, String key, String previous) {
		this.reason = reason;
		this.scope = scope;
		this.key = key;
		this.previous = previous;
	}

	public Reason getReason() {
		return reason;
	}

	public String getScope() {
		return scope;
	}

	public String getKey() {
		return key;
	}

	public String getPrevious() {
		return previous;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
