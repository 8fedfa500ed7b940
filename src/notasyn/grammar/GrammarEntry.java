package notasyn.grammar;

import notasyn.model.grammar.Production;
import notasyn.model.notation.Associativity;
import notasyn.model.notation.NotationEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

public class GrammarEntry {

	public static class GrammarLevel {
		private final Associativity associativity;
		private final List<Production> productions;

		GrammarLevel(Associativity associativity, List<Production> productions) {
			this.associativity = associativity;
			this.productions = productions;
		}

		public Associativity getAssociativity() {
			return associativity;
		}

		public List<Production> getProductions() {
			return Collections.unmodifiableList(productions);
		}
	}

	private final NotationEntry entry;
	private final SortedMap<Integer, GrammarLevel> levels;

	public GrammarEntry(NotationEntry entry) {
		this.entry = entry;
		this.levels = new TreeMap<>();
	}

	public NotationEntry getEntry() {
		return entry;
	}

	public SortedMap<Integer, GrammarLevel> getLevels() {
		return Collections.unmodifiableSortedMap(levels);
	}

	void add(int level, Associativity associativity, Production production) {
		levels.computeIfAbsent(level, l -> new GrammarLevel(
				associativity == null ? Associativity.NON : associativity, new ArrayList<>()))
				.productions.add(production);
	}

	GrammarEntry copy() {
		GrammarEntry copy = new GrammarEntry(entry);
		for (Map.Entry<Integer, GrammarLevel> level : levels.entrySet()) {
			copy.levels.put(level.getKey(), new GrammarLevel(
					level.getValue().associativity, new ArrayList<>(level.getValue().productions)));
		}
		return copy;
	}
}
