package notasyn.model.notation;

import notasyn.model.grammar.GrammarRule;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The parsing half of a syntax extension. The grammar rule is absent for print-only notations,
 * but the level is always known.
 */
public class ParsingExtension {

	private final NotationKey key;
	private final Level level;
	private final GrammarRule rule;
	private final List<EntryType> subentries;

	public ParsingExtension(NotationKey key, Level level, GrammarRule rule, List<EntryType> subentries) {
		this.key = key;
		this.level = level;
		this.rule = rule;
		this.subentries = Collections.unmodifiableList(subentries);
	}

	public NotationKey getKey() {
		return key;
	}

	public Level getLevel() {
		return level;
	}

	/**
	 * @return the synthesized grammar rule, or null when the notation is only used for printing
	 */
	public GrammarRule getRule() {
		return rule;
	}

	public List<EntryType> getSubentries() {
		return subentries;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ParsingExtension that = (ParsingExtension) o;
		return key.equals(that.key) && level.equals(that.level) && Objects.equals(rule, that.rule)
				&& subentries.equals(that.subentries);
	}

	@Override
	public int hashCode() {
		return Objects.hash(key, level, rule, subentries);
	}
}
