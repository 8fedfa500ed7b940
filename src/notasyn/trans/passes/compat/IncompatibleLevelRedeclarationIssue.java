package notasyn.trans.passes.compat;

import notasyn.errors.Issue;
import notasyn.errors.IssueVisitor;
import notasyn.model.notation.EntryType;
import notasyn.model.notation.Level;
import notasyn.model.notation.NotationKey;

import java.util.List;

public class IncompatibleLevelRedeclarationIssue extends Issue {

	private final NotationKey key;
	private final Level previousLevel;
	private final List<EntryType> previousSubentries;
	private final Level level;
	private final List<EntryType> subentries;

	public IncompatibleLevelRedeclarationIssue(NotationKey key, Level previousLevel, List<EntryType> previousSubentries,
											   Level level, List<EntryType> subentries) {
		this.key = key;
		this.previousLevel = previousLevel;
		this.previousSubentries = previousSubentries;
		this.level = level;
		this.subentries = subentries;
	}

	public NotationKey getKey() {
		return key;
	}

	public Level getPreviousLevel() {
		return previousLevel;
	}

	public List<EntryType> getPreviousSubentries() {
		return previousSubentries;
	}

	public Level getLevel() {
		return level;
	}

	public List<EntryType> getSubentries() {
		return subentries;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
