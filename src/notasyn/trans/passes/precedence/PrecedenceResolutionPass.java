package notasyn.trans.passes.precedence;

import notasyn.errors.IssueContext;
import notasyn.model.notation.*;
import notasyn.util.SourceLocation;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public class PrecedenceResolutionPass {

	private static final Logger logger = Logger.getLogger("notasyn.precedence");

	private PrecedenceResolutionPass() {}

	/**
	 * Determines the level of a notation. An explicit level is needed whenever the notation may be
	 * left-recursive; it is inferred to be 0 when the notation starts and ends with a terminal, or
	 * starts with an atomic variable.
	 *
	 * @param overrides the entry types the user gave to variables
	 * @return the level and associativity, or null after reporting an issue
	 */
	public static NotationPrecedence perform(IssueContext ctx, DecomposedNotation notation, NotationModifiers modifiers,
											 Map<String, EntryType> overrides) {
		Associativity associativity = modifiers.getAssociativity() == null
				? Associativity.NON : modifiers.getAssociativity();
		Integer level = findLevel(ctx, notation, modifiers, overrides);
		if (level == null) {
			return null;
		}
		return new NotationPrecedence(level, associativity);
	}

	private static Integer findLevel(IssueContext ctx, DecomposedNotation notation, NotationModifiers modifiers,
									 Map<String, EntryType> overrides) {
		Integer level = modifiers.getLevel();
		boolean onlyPrinting = modifiers.isOnlyPrinting();
		SourceLocation whole = SourceLocation.wholeOf(notation.getPattern());
		NotationSymbol first = firstNonBreak(notation.getSymbols());
		if (first == null) {
			return 0;
		}

		if (first instanceof NotationVariable) {
			String variable = ((NotationVariable) first).getName();
			EntryType override = overrides.get(variable);
			if (override == null) {
				if (level == null) {
					ctx.error(new AmbiguousLevelIssue(AmbiguousLevelIssue.Reason.LEFT_RECURSIVE, whole));
				}
				return level;
			}
			if (override instanceof SubExpressionEntryType) {
				SubExpressionEntryType sub = (SubExpressionEntryType) override;
				if (sub.getEntry().equals(modifiers.getEntry())
						&& sub.getLevel().getKind() != ProductionLevel.Kind.DEFAULT) {
					if (!onlyPrinting) {
						ctx.error(new InvalidLeftmostFormIssue(variable,
								InvalidLeftmostFormIssue.Reason.LEVEL_CANNOT_CHANGE, first.getLocation()));
						return null;
					}
					if (level == null) {
						ctx.error(new AmbiguousLevelIssue(AmbiguousLevelIssue.Reason.ONLY_PRINTING_LEFTMOST, whole));
					}
					return level;
				}
			}
			if (override.isAtomic()) {
				if (level == null) {
					logger.info("Setting notation at level 0.");
					return 0;
				}
				if (level != 0) {
					ctx.error(new InvalidLeftmostFormIssue(variable,
							InvalidLeftmostFormIssue.Reason.ATOMIC_NOT_AT_LEVEL_ZERO, first.getLocation()));
					return null;
				}
				return 0;
			}
			if ((override instanceof BinderEntryType || override instanceof PatternEntryType)
					&& !modifiers.getEntry().isCustom() && !onlyPrinting) {
				ctx.error(new InvalidLeftmostFormIssue(variable,
						InvalidLeftmostFormIssue.Reason.BINDER_OR_PATTERN, first.getLocation()));
				return null;
			}
			if (level == null) {
				ctx.error(new AmbiguousLevelIssue(AmbiguousLevelIssue.Reason.LEFTMOST_NEEDS_LEVEL, whole));
			}
			return level;
		}

		if (first instanceof NotationTerminal && lastIsTerminal(notation.getSymbols())) {
			if (level == null) {
				logger.info("Setting notation at level 0.");
				return 0;
			}
			return level;
		}

		if (level == null) {
			ctx.error(new AmbiguousLevelIssue(AmbiguousLevelIssue.Reason.UNDETERMINED, whole));
		}
		return level;
	}

	private static NotationSymbol firstNonBreak(List<NotationSymbol> symbols) {
		for (NotationSymbol symbol : symbols) {
			if (!(symbol instanceof NotationBreak)) {
				return symbol;
			}
		}
		return null;
	}

	private static boolean lastIsTerminal(List<NotationSymbol> symbols) {
		for (int i = symbols.size() - 1; i >= 0; i--) {
			NotationSymbol symbol = symbols.get(i);
			if (!(symbol instanceof NotationBreak)) {
				return symbol instanceof NotationTerminal;
			}
		}
		return false;
	}

	/**
	 * Recomputes the associativity the grammar level is extended with, from the associativity
	 * tags that remain on the border variables once entry types are resolved.
	 *
	 * @param types the entry types of the variables, in order
	 * @return the associativity, or null when neither border carries a left or right tag
	 */
	public static Associativity recomputeAssociativity(IssueContext ctx, DecomposedNotation notation,
														List<EntryType> types) {
		Associativity left = types.isEmpty() ? null : borderAssociativity(types.get(0));
		Associativity right = types.isEmpty() ? null : borderAssociativity(types.get(types.size() - 1));
		if (left == Associativity.LEFT && right == Associativity.RIGHT) {
			ctx.error(new ContradictoryAssociativityIssue(SourceLocation.wholeOf(notation.getPattern())));
			return null;
		}
		if (left == Associativity.LEFT) {
			return Associativity.LEFT;
		}
		if (right == Associativity.RIGHT) {
			return Associativity.RIGHT;
		}
		return null;
	}

	private static Associativity borderAssociativity(EntryType type) {
		if (type instanceof SubExpressionEntryType) {
			ProductionPosition position = ((SubExpressionEntryType) type).getPosition();
			if (position.isBorder()) {
				return position.getAssociativity();
			}
		}
		return null;
	}
}
