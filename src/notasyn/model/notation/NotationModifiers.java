package notasyn.model.notation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The modifiers a notation declaration may carry. Built fluently:
 *
 * <pre>
 * new NotationModifiers().atLevel(50).withAssociativity(Associativity.LEFT).withFormat("x  +  / y")
 * </pre>
 */
public class NotationModifiers {

	private Integer level;
	private Associativity associativity;
	private String customEntry;
	private final Map<String, EntryType> entryTypes = new LinkedHashMap<>();
	private final Map<String, ProductionLevel> variableLevels = new LinkedHashMap<>();
	private boolean onlyParsing;
	private boolean onlyPrinting;
	private String format;
	private final Map<String, String> extra = new LinkedHashMap<>();

	public NotationModifiers atLevel(int level) {
		this.level = level;
		return this;
	}

	public NotationModifiers withAssociativity(Associativity associativity) {
		this.associativity = associativity;
		return this;
	}

	public NotationModifiers inCustomEntry(String customEntry) {
		this.customEntry = customEntry;
		return this;
	}

	public NotationModifiers withEntryType(String variable, EntryType type) {
		entryTypes.put(variable, type);
		return this;
	}

	public NotationModifiers withVariableLevel(String variable, ProductionLevel level) {
		variableLevels.put(variable, level);
		return this;
	}

	public NotationModifiers onlyParsing() {
		this.onlyParsing = true;
		return this;
	}

	public NotationModifiers onlyPrinting() {
		this.onlyPrinting = true;
		return this;
	}

	public NotationModifiers withFormat(String format) {
		this.format = format;
		return this;
	}

	public NotationModifiers withExtra(String key, String value) {
		extra.put(key, value);
		return this;
	}

	public Integer getLevel() {
		return level;
	}

	public Associativity getAssociativity() {
		return associativity;
	}

	public String getCustomEntry() {
		return customEntry;
	}

	public NotationEntry getEntry() {
		return customEntry == null ? NotationEntry.constr() : NotationEntry.custom(customEntry);
	}

	public Map<String, EntryType> getEntryTypes() {
		return Collections.unmodifiableMap(entryTypes);
	}

	public Map<String, ProductionLevel> getVariableLevels() {
		return Collections.unmodifiableMap(variableLevels);
	}

	public boolean isOnlyParsing() {
		return onlyParsing;
	}

	public boolean isOnlyPrinting() {
		return onlyPrinting;
	}

	public String getFormat() {
		return format;
	}

	public Map<String, String> getExtra() {
		return Collections.unmodifiableMap(extra);
	}

	/**
	 * @return whether any modifier changes how the notation is parsed or printed, as opposed
	 * to only restricting how an already declared syntax is used
	 */
	public boolean affectsSyntax() {
		return level != null || associativity != null || !entryTypes.isEmpty() || !variableLevels.isEmpty()
				|| onlyPrinting || format != null || !extra.isEmpty();
	}

	public boolean hasEntryTypeModifiers() {
		return !entryTypes.isEmpty() || !variableLevels.isEmpty();
	}
}
