package notasyn.trans.passes.entry;

import notasyn.errors.IssueContext;
import notasyn.model.notation.*;
import notasyn.util.SourceLocation;

import java.util.*;

public class EntryTypeResolutionPass {

	private EntryTypeResolutionPass() {}

	/**
	 * Reads the per-variable modifiers of a declaration into entry types. A bare level stands for
	 * a sub-expression of the notation's own entry at that level.
	 *
	 * @return the entry types the user asked for, or null after reporting an issue
	 */
	public static Map<String, EntryType> interpretModifiers(IssueContext ctx, DecomposedNotation notation,
															NotationModifiers modifiers) {
		boolean ok = true;
		if (modifiers.isOnlyParsing() && modifiers.isOnlyPrinting()) {
			ctx.error(new ModifierIssue(ModifierIssue.Reason.ONLY_PARSING_AND_PRINTING, null));
			ok = false;
		}

		Map<String, EntryType> overrides = new LinkedHashMap<>(modifiers.getEntryTypes());
		for (Map.Entry<String, ProductionLevel> entry : modifiers.getVariableLevels().entrySet()) {
			if (overrides.containsKey(entry.getKey())) {
				ctx.error(new ModifierIssue(ModifierIssue.Reason.ENTRY_TYPE_AND_LEVEL, entry.getKey()));
				ok = false;
				continue;
			}
			overrides.put(entry.getKey(), new SubExpressionEntryType(
					modifiers.getEntry(), entry.getValue(), ProductionPosition.internal()));
		}

		Set<String> variables = new HashSet<>(notation.getAllVariables());
		for (String variable : overrides.keySet()) {
			if (!variables.contains(variable)) {
				ctx.error(new UnboundVariableIssue(variable, SourceLocation.wholeOf(notation.getPattern())));
				ok = false;
			}
		}
		return ok ? overrides : null;
	}

	/**
	 * Gives every variable its entry type: the user's choice merged with the position of the variable,
	 * or by default a sub-expression of the notation's entry, at the notation's level on the borders.
	 *
	 * @return the resolved types, or null after reporting an issue
	 */
	public static ResolvedEntryTypes perform(IssueContext ctx, DecomposedNotation notation, Map<String, EntryType> overrides,
											 NotationEntry entry, int level, Associativity associativity) {
		Map<String, EntryType> joined = joinRecursiveTypes(ctx, notation, overrides);
		if (joined == null) {
			return null;
		}

		Map<String, EntryType> types = new LinkedHashMap<>();
		for (Map.Entry<String, ProductionPosition> position : findPositions(notation.getSymbols(), associativity).entrySet()) {
			types.put(position.getKey(), setEntryType(entry, level, joined.get(position.getKey()), position.getValue()));
		}

		List<EntryType> subentries = new ArrayList<>();
		List<PrecedenceConstraint> constraints = new ArrayList<>();
		boolean ok = true;
		for (String variable : notation.getMainVariables()) {
			EntryType type = types.get(variable);
			subentries.add(type);
			PrecedenceConstraint constraint = PrecedenceTable.forGrammar(entry, level, type);
			if (constraint == null) {
				ctx.error(new InvalidSubentryLevelIssue(variable, ((SubExpressionEntryType) type).getEntry(), entry));
				ok = false;
				continue;
			}
			constraints.add(constraint);
		}
		if (!ok) {
			return null;
		}

		for (RecursiveVariablePair pair : notation.getRecursivePairs()) {
			types.put(pair.getLast(), types.get(pair.getFirst()));
		}
		return new ResolvedEntryTypes(types, subentries, new Level(entry, level, constraints));
	}

	/**
	 * Both ends of a recursive pattern parse the same way: the type given to one end is given to the
	 * other.
	 */
	private static Map<String, EntryType> joinRecursiveTypes(IssueContext ctx, DecomposedNotation notation,
															 Map<String, EntryType> overrides) {
		Map<String, EntryType> joined = new HashMap<>(overrides);
		boolean ok = true;
		for (RecursiveVariablePair pair : notation.getRecursivePairs()) {
			EntryType first = overrides.get(pair.getFirst());
			EntryType last = overrides.get(pair.getLast());
			if (first == null && last != null) {
				joined.put(pair.getFirst(), last);
			} else if (first != null && last != null && !first.equals(last)) {
				ctx.error(new ScopeMismatchIssue(pair, first, last));
				ok = false;
			}
		}
		return ok ? joined : null;
	}

	/**
	 * The position of each variable: the first one sits on the left border, a variable ending
	 * the notation on the right border, and every other one, including recursive lists, inside.
	 */
	private static Map<String, ProductionPosition> findPositions(List<NotationSymbol> symbols, Associativity associativity) {
		Map<String, ProductionPosition> positions = new LinkedHashMap<>();
		ProductionPosition current = ProductionPosition.border(BorderSide.LEFT, associativity);
		ProductionPosition last = ProductionPosition.border(BorderSide.RIGHT, associativity);
		for (int i = 0; i < symbols.size(); i++) {
			NotationSymbol symbol = symbols.get(i);
			if (symbol instanceof NotationVariable) {
				boolean isLast = i == symbols.size() - 1;
				positions.put(((NotationVariable) symbol).getName(), isLast ? last : current);
				current = ProductionPosition.internal();
			} else if (symbol instanceof NotationRecursiveList) {
				positions.put(((NotationRecursiveList) symbol).getVariable(), ProductionPosition.internal());
				current = ProductionPosition.internal();
			} else if (symbol instanceof NotationTerminal) {
				current = ProductionPosition.internal();
			}
		}
		return positions;
	}

	private static EntryType setEntryType(NotationEntry entry, int level, EntryType override, ProductionPosition position) {
		ProductionLevel computed = position.isBorder()
				? ProductionLevel.numeric(level) : ProductionLevel.defaultLevel();
		if (override == null) {
			return new SubExpressionEntryType(entry, computed, position);
		}
		if (!(override instanceof SubExpressionEntryType)) {
			return override;
		}
		SubExpressionEntryType sub = (SubExpressionEntryType) override;
		if (sub.getLevel().getKind() == ProductionLevel.Kind.DEFAULT) {
			if (sub.getEntry().equals(entry)) {
				return new SubExpressionEntryType(sub.getEntry(), computed, position);
			}
			return new SubExpressionEntryType(sub.getEntry(), ProductionLevel.defaultLevel(), position);
		}
		return new SubExpressionEntryType(sub.getEntry(), sub.getLevel(), position.withoutAssociativity());
	}
}
