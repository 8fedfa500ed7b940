package notasyn.model.notation;

import java.util.Objects;

/**
 * A named sub-grammar notations are declared in: either the main term grammar or a
 * user-declared custom entry.
 */
public final class NotationEntry {

	private static final NotationEntry CONSTR = new NotationEntry(null);

	private final String customName;

	private NotationEntry(String customName) {
		this.customName = customName;
	}

	public static NotationEntry constr() {
		return CONSTR;
	}

	public static NotationEntry custom(String name) {
		return new NotationEntry(name);
	}

	public boolean isCustom() {
		return customName != null;
	}

	public String getCustomName() {
		return customName;
	}

	/**
	 * @return the name under which the grammar engine knows this entry
	 */
	public String getGrammarName() {
		return isCustom() ? "custom:" + customName : "constr";
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Objects.equals(customName, ((NotationEntry) o).customName);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(customName);
	}

	@Override
	public String toString() {
		return isCustom() ? "custom " + customName : "constr";
	}
}
