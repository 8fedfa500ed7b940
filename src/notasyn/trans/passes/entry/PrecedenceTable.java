package notasyn.trans.passes.entry;

import notasyn.model.notation.*;

/**
 * Turns the level asked of a variable into the precedence constraint the grammar and the printer
 * apply to the sub-term it holds.
 */
public class PrecedenceTable {

	private PrecedenceTable() {}

	/**
	 * The constraint of a sub-expression of the notation's own entry, at a notation of level
	 * {@code notationLevel}. On a border, the associativity decides whether the sub-term may
	 * itself be at the notation's level.
	 */
	public static PrecedenceConstraint ofPositionAndLevel(int notationLevel, ProductionLevel level,
														  ProductionPosition position) {
		switch (level.getKind()) {
			case NUMERIC: {
				int n = level.getLevel();
				if (!position.isBorder() || position.getAssociativity() == null) {
					return PrecedenceConstraint.atMost(n);
				}
				BorderSide side = position.getSide();
				PrecedenceConstraint constraint;
				switch (position.getAssociativity()) {
					case RIGHT:
						constraint = side == BorderSide.LEFT
								? PrecedenceConstraint.strictlyBelow(n) : PrecedenceConstraint.atMost(n);
						break;
					case LEFT:
						constraint = side == BorderSide.LEFT
								? PrecedenceConstraint.atMost(n) : PrecedenceConstraint.strictlyBelow(n);
						break;
					default:
						constraint = PrecedenceConstraint.strictlyBelow(n);
				}
				return constraint.onSide(side);
			}
			case NEXT:
				return PrecedenceConstraint.strictlyBelow(notationLevel);
			default:
				return PrecedenceConstraint.unconstrained();
		}
	}

	/**
	 * @return the constraint the grammar puts on a variable of the given type, or null if the type
	 * asks for the next level of another entry, which has no meaning
	 */
	public static PrecedenceConstraint forGrammar(NotationEntry notationEntry, int notationLevel, EntryType type) {
		if (type instanceof SubExpressionEntryType) {
			SubExpressionEntryType sub = (SubExpressionEntryType) type;
			if (sub.getEntry().equals(notationEntry)) {
				return ofPositionAndLevel(notationLevel, sub.getLevel(), sub.getPosition()).withoutSide();
			}
			switch (sub.getLevel().getKind()) {
				case NUMERIC:
					return PrecedenceConstraint.atMost(sub.getLevel().getLevel());
				case NEXT:
					return null;
				default:
					return PrecedenceConstraint.unconstrained();
			}
		}
		if (type instanceof PatternEntryType) {
			Integer level = ((PatternEntryType) type).getLevel();
			return PrecedenceConstraint.atMost(level == null ? 0 : level);
		}
		return PrecedenceConstraint.unconstrained();
	}

	/**
	 * The constraint the printer uses to decide whether a sub-term needs parentheses. Sub-terms of
	 * custom entries are never parenthesised.
	 */
	public static PrecedenceConstraint forPrinting(int notationLevel, EntryType type) {
		if (type instanceof SubExpressionEntryType) {
			SubExpressionEntryType sub = (SubExpressionEntryType) type;
			if (sub.getEntry().isCustom()) {
				return PrecedenceConstraint.unconstrained();
			}
			return ofPositionAndLevel(notationLevel, sub.getLevel(), sub.getPosition());
		}
		if (type instanceof PatternEntryType) {
			Integer level = ((PatternEntryType) type).getLevel();
			return PrecedenceConstraint.atMost(level == null ? 0 : level);
		}
		return PrecedenceConstraint.unconstrained();
	}
}
