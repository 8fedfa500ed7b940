package notasyn.model.grammar;

import notasyn.model.notation.Associativity;
import notasyn.model.notation.NotationEntry;
import notasyn.model.notation.NotationKey;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The productions synthesized for one notation, to be installed at a level of an entry.
 */
public class GrammarRule {

	private final NotationKey key;
	private final int level;
	private final Associativity associativity;
	private final List<Production> productions;

	/**
	 * @param associativity the associativity the grammar level is extended with, null for none
	 */
	public GrammarRule(NotationKey key, int level, Associativity associativity, List<Production> productions) {
		this.key = key;
		this.level = level;
		this.associativity = associativity;
		this.productions = Collections.unmodifiableList(productions);
	}

	public NotationKey getKey() {
		return key;
	}

	public NotationEntry getEntry() {
		return key.getEntry();
	}

	public int getLevel() {
		return level;
	}

	public Associativity getAssociativity() {
		return associativity;
	}

	public List<Production> getProductions() {
		return productions;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GrammarRule that = (GrammarRule) o;
		return level == that.level && key.equals(that.key) && associativity == that.associativity
				&& productions.equals(that.productions);
	}

	@Override
	public int hashCode() {
		return Objects.hash(key, level, associativity, productions);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append(key).append(" at level ").append(level);
		if (associativity != null) {
			builder.append(", ").append(associativity.getDescription());
		}
		for (Production production : productions) {
			builder.append(System.lineSeparator()).append("  | ").append(production);
		}
		return builder.toString();
	}
}
