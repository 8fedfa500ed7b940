package notasyn.model.grammar;

import notasyn.model.notation.NotationEntry;
import notasyn.model.notation.PrecedenceConstraint;

import java.util.Objects;

/**
 * What a non-terminal of a production calls into.
 */
public final class ProductionEntry {

	public enum Kind {
		SUB_EXPRESSION,
		IDENT,
		NAME,
		REFERENCE,
		BIGINT,
		BINDER,
		PATTERN,
	}

	private final Kind kind;
	private final NotationEntry entry;
	private final PrecedenceConstraint constraint;
	private final boolean openBinder;
	private final int patternLevel;

	private ProductionEntry(Kind kind, NotationEntry entry, PrecedenceConstraint constraint, boolean openBinder,
							int patternLevel) {
		this.kind = kind;
		this.entry = entry;
		this.constraint = constraint;
		this.openBinder = openBinder;
		this.patternLevel = patternLevel;
	}

	public static ProductionEntry subExpression(NotationEntry entry, PrecedenceConstraint constraint) {
		return new ProductionEntry(Kind.SUB_EXPRESSION, entry, constraint.withoutSide(), false, -1);
	}

	public static ProductionEntry simple(Kind kind) {
		if (kind == Kind.SUB_EXPRESSION || kind == Kind.BINDER || kind == Kind.PATTERN) {
			throw new IllegalArgumentException(kind + " entries take parameters");
		}
		return new ProductionEntry(kind, null, null, false, -1);
	}

	public static ProductionEntry binder(boolean open) {
		return new ProductionEntry(Kind.BINDER, null, null, open, -1);
	}

	public static ProductionEntry pattern(int level) {
		return new ProductionEntry(Kind.PATTERN, null, null, false, level);
	}

	public Kind getKind() {
		return kind;
	}

	public NotationEntry getEntry() {
		return entry;
	}

	public PrecedenceConstraint getConstraint() {
		return constraint;
	}

	public boolean isOpenBinder() {
		return openBinder;
	}

	public int getPatternLevel() {
		return patternLevel;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ProductionEntry that = (ProductionEntry) o;
		return openBinder == that.openBinder && patternLevel == that.patternLevel && kind == that.kind
				&& Objects.equals(entry, that.entry) && Objects.equals(constraint, that.constraint);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, entry, constraint, openBinder, patternLevel);
	}

	@Override
	public String toString() {
		switch (kind) {
			case SUB_EXPRESSION:
				return entry + " " + constraint;
			case BINDER:
				return openBinder ? "binder" : "closed binder";
			case PATTERN:
				return "pattern at level " + patternLevel;
			default:
				return kind.name().toLowerCase();
		}
	}
}
