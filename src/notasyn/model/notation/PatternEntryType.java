package notasyn.model.notation;

import java.util.Objects;

public class PatternEntryType extends EntryType {

	private final boolean strict;
	private final Integer level;

	/**
	 * @param strict whether the pattern may only bind variables, not match constructors
	 * @param level the level of the pattern, or null for the default
	 */
	public PatternEntryType(boolean strict, Integer level) {
		this.strict = strict;
		this.level = level;
	}

	public boolean isStrict() {
		return strict;
	}

	public Integer getLevel() {
		return level;
	}

	@Override
	public <T, E extends Throwable> T accept(EntryTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(strict, level);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		PatternEntryType other = (PatternEntryType) obj;
		return strict == other.strict && Objects.equals(level, other.level);
	}
}
