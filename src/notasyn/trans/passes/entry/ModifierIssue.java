package notasyn.trans.passes.entry;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;

public class ModifierIssue extends Issue {

	public enum Reason {
		ENTRY_TYPE_AND_LEVEL,
		ONLY_PARSING_AND_PRINTING,
		ENTRY_TYPE_IN_INFIX,
	}

	private final Reason reason;
	private final String variable;

	/**
	 * @param variable the variable the conflicting modifiers are about, null if they concern the
	 *                 whole notation
	 */
	public ModifierIssue(Reason reason, String variable) {
		this.reason = reason;
		this.variable = variable;
	}

	public Reason getReason() {
		return reason;
	}

	public String getVariable() {
		return variable;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
