package notasyn.model.notation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The precedence data of a notation: the entry it lives in, its own level, and the grammar
 * precedence asked of each of its variables, in order. Two declarations of the same notation
 * must agree on it.
 */
public final class Level {

	private final NotationEntry entry;
	private final int level;
	private final List<PrecedenceConstraint> constraints;

	public Level(NotationEntry entry, int level, List<PrecedenceConstraint> constraints) {
		this.entry = entry;
		this.level = level;
		this.constraints = Collections.unmodifiableList(constraints);
	}

	public NotationEntry getEntry() {
		return entry;
	}

	public int getLevel() {
		return level;
	}

	public List<PrecedenceConstraint> getConstraints() {
		return constraints;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Level other = (Level) o;
		return level == other.level && entry.equals(other.entry) && constraints.equals(other.constraints);
	}

	@Override
	public int hashCode() {
		return Objects.hash(entry, level, constraints);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder("level ").append(level);
		if (entry.isCustom()) {
			builder.append(" of ").append(entry);
		}
		if (!constraints.isEmpty()) {
			builder.append(" with arguments");
			for (PrecedenceConstraint constraint : constraints) {
				builder.append(' ').append(constraint);
			}
		}
		return builder.toString();
	}
}
