package notasyn.model.notation;

import java.util.Objects;

/**
 * The level a user asks a sub-expression to be parsed at: a number, "next level", or nothing.
 */
public final class ProductionLevel {

	public enum Kind {
		NUMERIC,
		NEXT,
		DEFAULT,
	}

	private static final ProductionLevel NEXT = new ProductionLevel(Kind.NEXT, -1);
	private static final ProductionLevel DEFAULT = new ProductionLevel(Kind.DEFAULT, -1);

	private final Kind kind;
	private final int level;

	private ProductionLevel(Kind kind, int level) {
		this.kind = kind;
		this.level = level;
	}

	public static ProductionLevel numeric(int level) {
		return new ProductionLevel(Kind.NUMERIC, level);
	}

	public static ProductionLevel next() {
		return NEXT;
	}

	public static ProductionLevel defaultLevel() {
		return DEFAULT;
	}

	public Kind getKind() {
		return kind;
	}

	public int getLevel() {
		return level;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ProductionLevel that = (ProductionLevel) o;
		return level == that.level && kind == that.kind;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, level);
	}

	@Override
	public String toString() {
		switch (kind) {
			case NUMERIC:
				return "at level " + level;
			case NEXT:
				return "at next level";
			default:
				return "at default level";
		}
	}
}
