package notasyn.model.notation;

import java.util.Objects;

/**
 * A one-variable notation that only moves a sub-term from one entry or level into another. The
 * printer uses it to insert the notation when a term of the target kind is expected.
 */
public final class NotationCoercion {

	public enum Kind {
		/** a sub-expression of another entry, or of another level of the same custom entry */
		ENTRY_COERCION,
		/** a global reference embedded in a custom entry */
		ENTRY_GLOBAL,
		/** an identifier embedded in a custom entry */
		ENTRY_IDENT,
	}

	private final Kind kind;
	private final NotationEntry entry;
	private final int level;

	public NotationCoercion(Kind kind, NotationEntry entry, int level) {
		this.kind = kind;
		this.entry = entry;
		this.level = level;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return for an entry coercion, the entry of the sub-term; otherwise the custom entry of the notation
	 */
	public NotationEntry getEntry() {
		return entry;
	}

	public int getLevel() {
		return level;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		NotationCoercion that = (NotationCoercion) o;
		return level == that.level && kind == that.kind && entry.equals(that.entry);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, entry, level);
	}

	@Override
	public String toString() {
		return kind + " " + entry + " " + level;
	}
}
