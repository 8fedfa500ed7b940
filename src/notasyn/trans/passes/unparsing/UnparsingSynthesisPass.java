package notasyn.trans.passes.unparsing;

import notasyn.errors.IssueContext;
import notasyn.model.notation.*;
import notasyn.model.unparsing.*;
import notasyn.trans.passes.entry.PrecedenceTable;
import notasyn.trans.passes.entry.ResolvedEntryTypes;
import notasyn.trans.passes.grammar.NonProductiveRuleIssue;
import notasyn.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds the printing rule of a notation, either from the user's format or, when there is none,
 * by spacing the symbols of the pattern the usual way: no blank inside brackets or before a comma,
 * a rigid blank before an operator and a breakable one after it.
 */
public class UnparsingSynthesisPass {

	private static final Logger logger = Logger.getLogger("notasyn.unparsing");

	private UnparsingSynthesisPass() {}

	/**
	 * @return the printing rule, or null after reporting an issue
	 */
	public static PrintingRule perform(IssueContext ctx, DecomposedNotation notation, ResolvedEntryTypes types,
									   int level, NotationModifiers modifiers) {
		String format = modifiers.getFormat();
		if (format != null && modifiers.isOnlyParsing()) {
			ctx.warning(new IgnoredFormatIssue(SourceLocation.wholeOf(format)));
			format = null;
		}

		List<UnparsingInstruction> instructions;
		if (format == null) {
			instructions = new Heuristic(ctx, types, level).make(false, notation.getSymbols(), 0);
		} else {
			List<FormatItem> items = FormatParser.parse(ctx, format);
			if (items == null) {
				return null;
			}
			instructions = new FormatAlignment(ctx, types, level).alignAll(format, notation.getSymbols(), items);
		}
		if (instructions == null) {
			return null;
		}
		if (needsBox(instructions)) {
			instructions = Collections.singletonList(new UnparsingBox(UnparsingBox.Kind.HOV, 0, instructions));
		}
		logger.fine("Printing rule for \"" + notation.getPattern() + "\": " + instructions);
		return new PrintingRule(instructions, modifiers.getExtra());
	}

	private static boolean needsBox(List<UnparsingInstruction> instructions) {
		for (UnparsingInstruction instruction : instructions) {
			if (instruction instanceof UnparsingCut && ((UnparsingCut) instruction).getKind() == UnparsingCut.Kind.BREAK) {
				return true;
			}
			if (instruction instanceof UnparsingListMetaVariable || instruction instanceof UnparsingBinderListMetaVariable) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return the instruction printing a recursive list, or null after reporting an issue
	 */
	static UnparsingInstruction listInstruction(IssueContext ctx, NotationRecursiveList list, EntryType type,
												int level, List<UnparsingInstruction> separator) {
		if (type instanceof SubExpressionEntryType) {
			return new UnparsingListMetaVariable(list.getVariable(), PrecedenceTable.forPrinting(level, type), separator);
		}
		if (type instanceof BinderEntryType) {
			boolean open = ((BinderEntryType) type).isOpen();
			if (open && !list.getSeparator().isEmpty()) {
				ctx.error(new NonProductiveRuleIssue(
						NonProductiveRuleIssue.Reason.OPEN_BINDER_WITH_SEPARATOR, list.getLocation()));
				return null;
			}
			return new UnparsingBinderListMetaVariable(list.getVariable(), open, separator);
		}
		ctx.error(new NonProductiveRuleIssue(
				NonProductiveRuleIssue.Reason.INVALID_RECURSIVE_COMPONENT, list.getLocation()));
		return null;
	}

	private static class Heuristic {
		private final IssueContext ctx;
		private final ResolvedEntryTypes types;
		private final int level;

		Heuristic(IssueContext ctx, ResolvedEntryTypes types, int level) {
			this.ctx = ctx;
			this.types = types;
			this.level = level;
		}

		/**
		 * @param simulated whether a non-terminal is assumed to follow the symbols, as it does
		 *                  for the separator of a recursive list
		 * @return the instructions for the symbols from index {@code i} on, or null after reporting an issue
		 */
		List<UnparsingInstruction> make(boolean simulated, List<NotationSymbol> symbols, int i) {
			if (i == symbols.size()) {
				return new ArrayList<>();
			}
			NotationSymbol symbol = symbols.get(i);
			if (symbol instanceof NotationVariable) {
				String variable = ((NotationVariable) symbol).getName();
				UnparsingInstruction metaVariable = types.getType(variable)
						.accept(new MetaVariableInstructionVisitor(variable, level));
				List<UnparsingInstruction> rest = isNextNonTerminal(simulated, symbols, i + 1)
						? addBreakIfNone(1, simulated, make(simulated, symbols, i + 1))
						: makeWithSpace(simulated, symbols, i + 1);
				return prepend(metaVariable, rest);
			}
			if (symbol instanceof NotationTerminal) {
				String text = ((NotationTerminal) symbol).getText();
				List<UnparsingInstruction> rest = make(simulated, symbols, i + 1);
				if (rest == null) {
					return null;
				}
				if (simulated || hasNonTerminalFrom(symbols, i + 1)) {
					if (NotationTokens.isComma(text) || NotationTokens.isOperator(text)) {
						return prepend(new UnparsingLiteral(text), addBreakIfNone(1, simulated, rest));
					}
					if (NotationTokens.isRightBracket(text) && next(symbols, i + 1) instanceof NotationTerminal) {
						return prepend(new UnparsingLiteral(text), addBreakIfNone(0, simulated, rest));
					}
					if (NotationTokens.isLeftBracket(text) && isNextNonTerminal(simulated, symbols, i + 1)) {
						return prepend(new UnparsingLiteral(text), rest);
					}
					if (!(next(symbols, i + 1) instanceof NotationBreak)) {
						return prepend(new UnparsingLiteral(text + " "), rest);
					}
					return prepend(new UnparsingLiteral(text), rest);
				}
				if (next(symbols, i + 1) instanceof NotationTerminal) {
					return prepend(new UnparsingLiteral(text + " "), rest);
				}
				return prepend(new UnparsingLiteral(text), rest);
			}
			if (symbol instanceof NotationBreak) {
				List<UnparsingInstruction> rest = make(simulated, symbols, i + 1);
				return rest == null ? null
						: prepend(UnparsingCut.breakable(((NotationBreak) symbol).getWidth(), 0), rest);
			}
			NotationRecursiveList list = (NotationRecursiveList) symbol;
			List<UnparsingInstruction> separator = list.getSeparator().isEmpty()
					? Collections.singletonList(UnparsingCut.breakable(1, 0))
					: make(true, list.getSeparator(), 0);
			if (separator == null) {
				return null;
			}
			UnparsingInstruction instruction = listInstruction(
					ctx, list, types.getType(list.getVariable()), level, separator);
			if (instruction == null) {
				return null;
			}
			return prepend(instruction, makeWithSpace(simulated, symbols, i + 1));
		}

		private List<UnparsingInstruction> makeWithSpace(boolean simulated, List<NotationSymbol> symbols, int i) {
			if (i == symbols.size()) {
				return new ArrayList<>();
			}
			NotationSymbol symbol = symbols.get(i);
			if (symbol instanceof NotationTerminal) {
				String text = ((NotationTerminal) symbol).getText();
				if (NotationTokens.isOperator(text)) {
					List<UnparsingInstruction> rest = make(simulated, symbols, i + 1);
					return rest == null ? null
							: prepend(new UnparsingLiteral(" " + text), addBreakIfNone(1, simulated, rest));
				}
				if (NotationTokens.isComma(text) || NotationTokens.isRightBracket(text)) {
					return make(simulated, symbols, i);
				}
				return addBreakIfNone(1, simulated, make(simulated, symbols, i));
			}
			if (symbol.isNonTerminal()) {
				return addBreakIfNone(1, simulated, make(simulated, symbols, i));
			}
			return make(simulated, symbols, i);
		}

		private static NotationSymbol next(List<NotationSymbol> symbols, int i) {
			return i < symbols.size() ? symbols.get(i) : null;
		}

		private static boolean isNextNonTerminal(boolean simulated, List<NotationSymbol> symbols, int i) {
			return i == symbols.size() ? simulated : symbols.get(i).isNonTerminal();
		}

		private static boolean hasNonTerminalFrom(List<NotationSymbol> symbols, int i) {
			for (int k = i; k < symbols.size(); k++) {
				if (symbols.get(k).isNonTerminal()) {
					return true;
				}
			}
			return false;
		}

		/**
		 * Adds a breakable cut in front of the instructions unless they already start with one.
		 * Nothing is added at the very end of the notation.
		 */
		private static List<UnparsingInstruction> addBreakIfNone(int width, boolean simulated,
																 List<UnparsingInstruction> instructions) {
			if (instructions == null) {
				return null;
			}
			if (!instructions.isEmpty() && instructions.get(0) instanceof UnparsingCut
					&& ((UnparsingCut) instructions.get(0)).getKind() == UnparsingCut.Kind.BREAK) {
				return instructions;
			}
			if (instructions.isEmpty() && !simulated) {
				return instructions;
			}
			return prepend(UnparsingCut.breakable(width, 0), instructions);
		}

		private static List<UnparsingInstruction> prepend(UnparsingInstruction first, List<UnparsingInstruction> rest) {
			if (rest == null) {
				return null;
			}
			rest.add(0, first);
			return rest;
		}
	}
}
