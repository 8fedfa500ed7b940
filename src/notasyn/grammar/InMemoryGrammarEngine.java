package notasyn.grammar;

import notasyn.model.grammar.Production;
import notasyn.model.notation.Associativity;
import notasyn.model.notation.NotationEntry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps the installed productions in memory, per entry and level. Starts with the main entry.
 */
public class InMemoryGrammarEngine implements GrammarEngine {

	private final Map<String, GrammarEntry> entries;

	public InMemoryGrammarEngine() {
		this.entries = new LinkedHashMap<>();
		createEntry(NotationEntry.constr());
	}

	private InMemoryGrammarEngine(Map<String, GrammarEntry> entries) {
		this.entries = entries;
	}

	@Override
	public GrammarEntry lookupEntry(String name) {
		return entries.get(name);
	}

	@Override
	public void createEntry(NotationEntry entry) {
		entries.putIfAbsent(entry.getGrammarName(), new GrammarEntry(entry));
	}

	@Override
	public Associativity getLevelAssociativity(NotationEntry entry, int level) {
		GrammarEntry grammarEntry = entries.get(entry.getGrammarName());
		if (grammarEntry == null || !grammarEntry.getLevels().containsKey(level)) {
			return null;
		}
		return grammarEntry.getLevels().get(level).getAssociativity();
	}

	@Override
	public void addProduction(NotationEntry entry, int level, Associativity associativity, Production production) {
		GrammarEntry grammarEntry = entries.get(entry.getGrammarName());
		if (grammarEntry == null) {
			throw new IllegalArgumentException("no grammar entry " + entry);
		}
		grammarEntry.add(level, associativity, production);
	}

	public Collection<GrammarEntry> getEntries() {
		return Collections.unmodifiableCollection(entries.values());
	}

	public InMemoryGrammarEngine copy() {
		Map<String, GrammarEntry> copies = new LinkedHashMap<>();
		for (Map.Entry<String, GrammarEntry> entry : entries.entrySet()) {
			copies.put(entry.getKey(), entry.getValue().copy());
		}
		return new InMemoryGrammarEngine(copies);
	}
}
