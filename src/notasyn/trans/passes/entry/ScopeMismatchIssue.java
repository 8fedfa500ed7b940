package notasyn.trans.passes.entry;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.model.notation.EntryType;
import notasyn.model.notation.RecursiveVariablePair;

/**
 * Both ends of a recursive pattern were given different entry types.
 */
public class ScopeMismatchIssue extends Issue {
	private final RecursiveVariablePair pair;
	private final EntryType firstType;
	private final EntryType lastType;

	public ScopeMismatchIssue(RecursiveVariablePair pair, EntryType firstType, EntryType lastType) {
		this.pair = pair;
		this.firstType = firstType;
		this.lastType = lastType;
	}

	public RecursiveVariablePair getPair() {
		return pair;
	}

	public EntryType getFirstType() {
		return firstType;
	}

	public EntryType getLastType() {
		return lastType;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
