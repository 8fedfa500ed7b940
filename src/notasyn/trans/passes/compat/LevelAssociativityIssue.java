package notasyn.trans.passes.compat;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.model.notation.Associativity;
import notasyn.model.notation.NotationEntry;

public class LevelAssociativityIssue extends Issue {

	private final NotationEntry entry;
	private final int level;
	private final Associativity previousAssociativity;
	private final Associativity associativity;

	public LevelAssociativityIssue(NotationEntry entry, int level, Associativity previousAssociativity, Associativity associativity) {
		this.entry = entry;
		this.level = level;
		this.previousAssociativity = previousAssociativity;
		this.associativity = associativity;
	}

	public NotationEntry getEntry() {
		return entry;
	}

	public int getLevel() {
		return level;
	}

	public Associativity getPreviousAssociativity() {
		return previousAssociativity;
	}

	public Associativity getAssociativity() {
		return associativity;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
