package notasyn.state;

import notasyn.model.grammar.GrammarRule;
import notasyn.model.notation.Abbreviation;
import notasyn.model.notation.EntryType;
import notasyn.model.notation.Level;
import notasyn.model.notation.NotationInterpretation;
import notasyn.model.notation.NotationKey;
import notasyn.model.notation.PrintingExtension;
import notasyn.model.unparsing.PrintingRule;

import java.util.*;

/**
 * Everything registered per notation key: its level and sub-entries, its grammar rule, its generic
 * printing rule, the printing rules specific to a scope, and its interpretations. Abbreviations are
 * kept by name.
 */
public class NotationRegistry {

	/**
	 * A printing rule attached to a notation in one scope only.
	 */
	public static final class ScopedKey {
		private final String scope;
		private final NotationKey key;

		public ScopedKey(String scope, NotationKey key) {
			this.scope = scope;
			this.key = key;
		}

		public String getScope() {
			return scope;
		}

		public NotationKey getKey() {
			return key;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			ScopedKey that = (ScopedKey) o;
			return Objects.equals(scope, that.scope) && key.equals(that.key);
		}

		@Override
		public int hashCode() {
			return Objects.hash(scope, key);
		}
	}

	private final Map<NotationKey, Level> levels;
	private final Map<NotationKey, List<EntryType>> subentries;
	private final Map<NotationKey, GrammarRule> grammarRules;
	private final Map<NotationKey, PrintingExtension> printingRules;
	private final Map<ScopedKey, PrintingRule> specificPrintingRules;
	private final List<NotationInterpretation> interpretations;
	private final Map<String, Abbreviation> abbreviations;

	public NotationRegistry() {
		this(new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>(),
				new LinkedHashMap<>(), new ArrayList<>(), new LinkedHashMap<>());
	}

	private NotationRegistry(Map<NotationKey, Level> levels, Map<NotationKey, List<EntryType>> subentries,
							 Map<NotationKey, GrammarRule> grammarRules, Map<NotationKey, PrintingExtension> printingRules,
							 Map<ScopedKey, PrintingRule> specificPrintingRules,
							 List<NotationInterpretation> interpretations, Map<String, Abbreviation> abbreviations) {
		this.levels = levels;
		this.subentries = subentries;
		this.grammarRules = grammarRules;
		this.printingRules = printingRules;
		this.specificPrintingRules = specificPrintingRules;
		this.interpretations = interpretations;
		this.abbreviations = abbreviations;
	}

	/**
	 * @return the level of the notation, or null if it was never registered
	 */
	public Level getLevel(NotationKey key) {
		return levels.get(key);
	}

	public List<EntryType> getSubentries(NotationKey key) {
		return subentries.getOrDefault(key, Collections.emptyList());
	}

	public void declareLevel(NotationKey key, Level level, List<EntryType> types) {
		levels.put(key, level);
		subentries.put(key, Collections.unmodifiableList(new ArrayList<>(types)));
	}

	/**
	 * @return the grammar rule, or null if the notation was registered for printing only
	 */
	public GrammarRule getGrammarRule(NotationKey key) {
		return grammarRules.get(key);
	}

	public void declareGrammarRule(NotationKey key, GrammarRule rule) {
		grammarRules.put(key, rule);
	}

	public PrintingExtension getPrintingRule(NotationKey key) {
		return printingRules.get(key);
	}

	public void declarePrintingRule(NotationKey key, PrintingExtension printing) {
		printingRules.put(key, printing);
	}

	public PrintingRule getSpecificPrintingRule(String scope, NotationKey key) {
		return specificPrintingRules.get(new ScopedKey(scope, key));
	}

	public void declareSpecificPrintingRule(String scope, NotationKey key, PrintingRule rule) {
		specificPrintingRules.put(new ScopedKey(scope, key), rule);
	}

	public void addInterpretation(NotationInterpretation interpretation) {
		interpretations.add(interpretation);
	}

	public List<NotationInterpretation> getInterpretations() {
		return Collections.unmodifiableList(interpretations);
	}

	public List<NotationInterpretation> getInterpretations(NotationKey key) {
		List<NotationInterpretation> result = new ArrayList<>();
		for (NotationInterpretation interpretation : interpretations) {
			if (interpretation.getKey().equals(key)) {
				result.add(interpretation);
			}
		}
		return result;
	}

	/**
	 * Declares the abbreviation, replacing any other of the same name.
	 */
	public void declareAbbreviation(Abbreviation abbreviation) {
		abbreviations.put(abbreviation.getName(), abbreviation);
	}

	/**
	 * @return the abbreviation, or null
	 */
	public Abbreviation getAbbreviation(String name) {
		return abbreviations.get(name);
	}

	public Collection<Abbreviation> getAbbreviations() {
		return Collections.unmodifiableCollection(abbreviations.values());
	}

	public Set<NotationKey> getKeys() {
		return Collections.unmodifiableSet(levels.keySet());
	}

	public NotationRegistry copy() {
		return new NotationRegistry(new LinkedHashMap<>(levels), new LinkedHashMap<>(subentries),
				new LinkedHashMap<>(grammarRules), new LinkedHashMap<>(printingRules),
				new LinkedHashMap<>(specificPrintingRules), new ArrayList<>(interpretations),
				new LinkedHashMap<>(abbreviations));
	}
}
