package notasyn.trans.passes.entry;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.model.notation.NotationEntry;

/**
 * "next level" was asked of a variable parsed in another entry than the notation's own.
 */
public class InvalidSubentryLevelIssue extends Issue {
	private final String variable;
	private final NotationEntry variableEntry;
	private final NotationEntry notationEntry;

	public InvalidSubentryLevelIssue(String variable, NotationEntry variableEntry, NotationEntry notationEntry) {
		this.variable = variable;
		this.variableEntry = variableEntry;
		this.notationEntry = notationEntry;
	}

	public String getVariable() {
		return variable;
	}

	public NotationEntry getVariableEntry() {
		return variableEntry;
	}

	public NotationEntry getNotationEntry() {
		return notationEntry;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
