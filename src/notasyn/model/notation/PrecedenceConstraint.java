package notasyn.model.notation;

import java.util.Objects;

/**
 * A bound on the level of the sub-term a notation variable may hold, optionally remembering
 * on which border of the notation the variable sits.
 */
public final class PrecedenceConstraint {

	public enum Kind {
		STRICTLY_BELOW,
		AT_MOST,
		UNCONSTRAINED,
	}

	private static final PrecedenceConstraint UNCONSTRAINED = new PrecedenceConstraint(Kind.UNCONSTRAINED, -1, null);

	private final Kind kind;
	private final int level;
	private final BorderSide side;

	private PrecedenceConstraint(Kind kind, int level, BorderSide side) {
		this.kind = kind;
		this.level = level;
		this.side = side;
	}

	public static PrecedenceConstraint strictlyBelow(int level) {
		return new PrecedenceConstraint(Kind.STRICTLY_BELOW, level, null);
	}

	public static PrecedenceConstraint atMost(int level) {
		return new PrecedenceConstraint(Kind.AT_MOST, level, null);
	}

	public static PrecedenceConstraint unconstrained() {
		return UNCONSTRAINED;
	}

	public PrecedenceConstraint onSide(BorderSide side) {
		return new PrecedenceConstraint(kind, level, side);
	}

	public PrecedenceConstraint withoutSide() {
		return side == null ? this : new PrecedenceConstraint(kind, level, null);
	}

	public Kind getKind() {
		return kind;
	}

	public int getLevel() {
		return level;
	}

	public BorderSide getSide() {
		return side;
	}

	/**
	 * @param termLevel the level of a sub-term
	 * @return whether a sub-term of that level may appear here without parentheses
	 */
	public boolean accepts(int termLevel) {
		switch (kind) {
			case STRICTLY_BELOW:
				return termLevel < level;
			case AT_MOST:
				return termLevel <= level;
			default:
				return true;
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PrecedenceConstraint that = (PrecedenceConstraint) o;
		return level == that.level && kind == that.kind && side == that.side;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, level, side);
	}

	@Override
	public String toString() {
		switch (kind) {
			case STRICTLY_BELOW:
				return "at level below " + level;
			case AT_MOST:
				return "at level " + level;
			default:
				return "at any level";
		}
	}
}
