package notasyn.trans.passes.printability;

import notasyn.errors.IssueContext;
import notasyn.model.notation.*;
import notasyn.model.term.NotationTerm;
import notasyn.model.term.Reversibility;
import notasyn.model.term.TermOpaque;
import notasyn.model.term.TermVariable;
import notasyn.trans.passes.entry.PrecedenceTable;
import notasyn.util.SourceLocation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class PrintabilityCheckPass {

	private PrintabilityCheckPass() {}

	/**
	 * An interpretation is reversible when it contains no opaque construct and mentions every
	 * variable of the notation.
	 */
	public static Reversibility reversibility(List<String> notationVariables, NotationTerm interpretation) {
		Set<String> mentioned = new HashSet<>();
		ReversibilityVisitor visitor = new ReversibilityVisitor(mentioned);
		interpretation.accept(visitor);
		if (visitor.getFirstOpaque() != null) {
			return Reversibility.hasOpaque();
		}
		List<String> missing = new ArrayList<>();
		for (String variable : notationVariables) {
			if (!mentioned.contains(variable)) {
				missing.add(variable);
			}
		}
		return missing.isEmpty() ? Reversibility.reversible() : Reversibility.nonInjective(missing);
	}

	/**
	 * Decides whether an interpretation can be used for printing. A bare variable is never printed
	 * with the notation, unless the notation is a coercion between entries; an interpretation that
	 * is not reversible is kept for parsing only. Both cases are warnings.
	 *
	 * @param level the level of the notation, or null for a numeral notation
	 */
	public static Printability perform(IssueContext ctx, String pattern, Level level, List<EntryType> subentries,
									   boolean onlyParsing, NotationTerm interpretation, Reversibility reversibility) {
		SourceLocation whole = SourceLocation.wholeOf(pattern);
		if (interpretation instanceof TermVariable && reversibility.getKind() == Reversibility.Kind.A_PRIORI_REVERSIBLE) {
			NotationCoercion coercion = findCoercion(level, subentries);
			if (!onlyParsing && coercion == null) {
				ctx.warning(new VariableBoundNotationIssue(((TermVariable) interpretation).getName(), whole));
			}
			return new Printability(true, coercion);
		}
		if (!onlyParsing && reversibility.getKind() != Reversibility.Kind.A_PRIORI_REVERSIBLE) {
			if (reversibility.getKind() == Reversibility.Kind.NON_INJECTIVE) {
				ctx.warning(new NonInjectiveInterpretationIssue(reversibility.getMissingVariables(), whole));
			} else {
				ReversibilityVisitor visitor = new ReversibilityVisitor(new HashSet<>());
				interpretation.accept(visitor);
				TermOpaque opaque = visitor.getFirstOpaque();
				ctx.warning(new OpaqueInterpretationIssue(opaque.getDescription(), whole));
			}
			return new Printability(true, null);
		}
		return new Printability(onlyParsing, null);
	}

	/**
	 * @return null when the interpretation is used neither for parsing nor for printing
	 */
	public static NotationUse makeUse(IssueContext ctx, String pattern, boolean withSyntax,
									  boolean onlyParsing, boolean onlyPrinting) {
		if (onlyParsing && onlyPrinting) {
			ctx.warning(new UnusedInterpretationIssue(withSyntax, SourceLocation.wholeOf(pattern)));
			return null;
		}
		if (onlyParsing) {
			return NotationUse.ONLY_PARSING;
		}
		if (onlyPrinting) {
			return NotationUse.ONLY_PRINTING;
		}
		return NotationUse.PARSING_AND_PRINTING;
	}

	/**
	 * A one-variable notation is a coercion when its variable lives in another entry or level than
	 * the notation itself. Sub-expressions of the main entry all share one entry level.
	 */
	static NotationCoercion findCoercion(Level level, List<EntryType> subentries) {
		if (level == null || subentries.size() != 1) {
			return null;
		}
		EntryType type = subentries.get(0);
		NotationEntry entry = level.getEntry();
		if (type instanceof SubExpressionEntryType) {
			SubExpressionEntryType sub = (SubExpressionEntryType) type;
			if (!sub.getEntry().isCustom()) {
				return entry.isCustom() ? new NotationCoercion(NotationCoercion.Kind.ENTRY_COERCION, sub.getEntry(), 0) : null;
			}
			int subLevel = subentryLevel(level.getLevel(), sub);
			if (sub.getEntry().equals(entry) && subLevel == level.getLevel()) {
				return null;
			}
			return new NotationCoercion(NotationCoercion.Kind.ENTRY_COERCION, sub.getEntry(), subLevel);
		}
		if (type instanceof GlobalReferenceEntryType && entry.isCustom()) {
			return new NotationCoercion(NotationCoercion.Kind.ENTRY_GLOBAL, entry, level.getLevel());
		}
		if (type instanceof IdentEntryType && entry.isCustom()) {
			return new NotationCoercion(NotationCoercion.Kind.ENTRY_IDENT, entry, level.getLevel());
		}
		return null;
	}

	private static int subentryLevel(int notationLevel, SubExpressionEntryType sub) {
		PrecedenceConstraint constraint = PrecedenceTable.ofPositionAndLevel(notationLevel, sub.getLevel(), sub.getPosition());
		switch (constraint.getKind()) {
			case STRICTLY_BELOW:
				return constraint.getLevel() - 1;
			case AT_MOST:
				return constraint.getLevel();
			default:
				return Integer.MAX_VALUE;
		}
	}
}
