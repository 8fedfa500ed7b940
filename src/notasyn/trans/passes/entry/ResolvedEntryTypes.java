package notasyn.trans.passes.entry;

import notasyn.model.notation.EntryType;
import notasyn.model.notation.Level;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The entry type of every variable of a notation, and the level they make up.
 */
public class ResolvedEntryTypes {
	private final Map<String, EntryType> types;
	private final List<EntryType> subentries;
	private final Level level;

	public ResolvedEntryTypes(Map<String, EntryType> types, List<EntryType> subentries, Level level) {
		this.types = Collections.unmodifiableMap(types);
		this.subentries = Collections.unmodifiableList(subentries);
		this.level = level;
	}

	/**
	 * @return the type of each variable, including the closing variables of recursive patterns
	 */
	public Map<String, EntryType> getTypes() {
		return types;
	}

	public EntryType getType(String variable) {
		return types.get(variable);
	}

	/**
	 * @return the types of the main variables, in order
	 */
	public List<EntryType> getSubentries() {
		return subentries;
	}

	public Level getLevel() {
		return level;
	}
}
