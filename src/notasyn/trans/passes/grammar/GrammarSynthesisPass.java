package notasyn.trans.passes.grammar;

import notasyn.errors.IssueContext;
import notasyn.lexer.KeywordTable;
import notasyn.model.grammar.*;
import notasyn.model.notation.*;
import notasyn.trans.passes.entry.ResolvedEntryTypes;
import notasyn.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

public class GrammarSynthesisPass {

	private static final Logger logger = Logger.getLogger("notasyn.grammar");

	private GrammarSynthesisPass() {}

	/**
	 * Builds the productions parsing a notation. Every recursive list of sub-expressions expands into
	 * two productions per alternative of what follows it: one for exactly p+1 elements, and one for
	 * p+2 elements or more, p being the number of trailing repetitions of the list pattern that
	 * follow the list in the notation.
	 *
	 * @return the grammar rule, or null after reporting an issue
	 */
	public static GrammarRule perform(IssueContext ctx, KeywordTable keywords, DecomposedNotation notation,
									  ResolvedEntryTypes types, NotationKey key, int level, Associativity associativity) {
		SourceLocation whole = SourceLocation.wholeOf(notation.getPattern());
		if (!key.getEntry().isCustom() && !checkProductivity(ctx, notation.getSymbols(), whole)) {
			return null;
		}

		Synthesizer synthesizer = new Synthesizer(ctx, keywords, types, new ProductionEntryVisitor(key.getEntry(), level));
		List<List<ProductionElement>> alternatives = synthesizer.alternatives(notation.getSymbols(), 0);
		if (alternatives == null) {
			return null;
		}

		List<Production> productions = new ArrayList<>();
		for (List<ProductionElement> alternative : alternatives) {
			productions.add(new Production(defineKeywords(keywords, alternative)));
		}
		return new GrammarRule(key, level, associativity, productions);
	}

	private static boolean checkProductivity(IssueContext ctx, List<NotationSymbol> symbols, SourceLocation whole) {
		boolean hasSymbol = false;
		for (NotationSymbol symbol : symbols) {
			if (!(symbol instanceof NotationVariable) && !(symbol instanceof NotationBreak)) {
				hasSymbol = true;
				break;
			}
		}
		if (!hasSymbol) {
			ctx.error(new NonProductiveRuleIssue(NonProductiveRuleIssue.Reason.NO_SYMBOL, whole));
			return false;
		}
		if (symbols.get(0) instanceof NotationRecursiveList) {
			ctx.error(new NonProductiveRuleIssue(NonProductiveRuleIssue.Reason.STARTS_WITH_RECURSIVE_LIST,
					symbols.get(0).getLocation()));
			return false;
		}
		return true;
	}

	/**
	 * Identifier-shaped terminals that start a production, or that directly follow a sub-expression,
	 * become keywords, otherwise the sub-expression would swallow them as identifiers.
	 */
	private static List<ProductionElement> defineKeywords(KeywordTable keywords, List<ProductionElement> elements) {
		List<ProductionElement> result = new ArrayList<>(elements);
		for (int i = 0; i < result.size(); i++) {
			if (!(result.get(i) instanceof TerminalElement)) {
				continue;
			}
			TerminalElement terminal = (TerminalElement) result.get(i);
			if (terminal.isKeyword()) {
				continue;
			}
			boolean articulation = i == 0 || (result.get(i - 1) instanceof NonTerminalElement
					&& ((NonTerminalElement) result.get(i - 1)).getEntry().getKind() == ProductionEntry.Kind.SUB_EXPRESSION);
			if (articulation) {
				logger.info("Identifier '" + terminal.getText() + "' now a keyword");
				keywords.register(terminal.getText());
				result.set(i, new TerminalElement(terminal.getText(), true));
			}
		}
		return result;
	}

	private static class Synthesizer {
		private final IssueContext ctx;
		private final KeywordTable keywords;
		private final ResolvedEntryTypes types;
		private final ProductionEntryVisitor entries;

		Synthesizer(IssueContext ctx, KeywordTable keywords, ResolvedEntryTypes types, ProductionEntryVisitor entries) {
			this.ctx = ctx;
			this.keywords = keywords;
			this.types = types;
			this.entries = entries;
		}

		TerminalElement terminal(String text) {
			return new TerminalElement(text, keywords.isKeyword(text) || !NotationTokens.isIdent(text));
		}

		/**
		 * @return every production suffix for the symbols from index {@code from} on
		 */
		List<List<ProductionElement>> alternatives(List<NotationSymbol> symbols, int from) {
			if (from == symbols.size()) {
				List<List<ProductionElement>> empty = new ArrayList<>();
				empty.add(Collections.emptyList());
				return empty;
			}
			NotationSymbol symbol = symbols.get(from);
			if (symbol instanceof NotationBreak) {
				return alternatives(symbols, from + 1);
			}
			if (symbol instanceof NotationTerminal) {
				List<List<ProductionElement>> rest = alternatives(symbols, from + 1);
				return rest == null ? null : distribute(Collections.singletonList(
						terminal(((NotationTerminal) symbol).getText())), rest);
			}
			if (symbol instanceof NotationVariable) {
				String variable = ((NotationVariable) symbol).getName();
				List<List<ProductionElement>> rest = alternatives(symbols, from + 1);
				return rest == null ? null : distribute(Collections.singletonList(
						new NonTerminalElement(variable, types.getType(variable).accept(entries))), rest);
			}
			return recursiveList(symbols, from, (NotationRecursiveList) symbol);
		}

		private List<List<ProductionElement>> recursiveList(List<NotationSymbol> symbols, int from, NotationRecursiveList list) {
			List<TerminalElement> separator = new ArrayList<>();
			for (NotationSymbol symbol : list.getSeparator()) {
				if (symbol instanceof NotationTerminal) {
					separator.add(terminal(((NotationTerminal) symbol).getText()));
				} else if (!(symbol instanceof NotationBreak)) {
					ctx.error(new NonProductiveRuleIssue(
							NonProductiveRuleIssue.Reason.NON_TERMINAL_IN_SEPARATOR, symbol.getLocation()));
					return null;
				}
			}

			String variable = list.getVariable();
			EntryType type = types.getType(variable);
			if (type instanceof SubExpressionEntryType) {
				SubExpressionEntryType sub = (SubExpressionEntryType) type;
				int trailing = 0;
				int next = from + 1;
				while (true) {
					int after = matchTrailingPattern(symbols, next, list.getSeparator(), sub);
					if (after < 0) {
						break;
					}
					trailing++;
					next = after;
				}
				List<List<ProductionElement>> rest = alternatives(symbols, next);
				if (rest == null) {
					return null;
				}
				return expandList(variable, type.accept(entries), separator, trailing, rest);
			}
			if (type instanceof BinderEntryType) {
				boolean open = ((BinderEntryType) type).isOpen();
				if (open && !list.getSeparator().isEmpty()) {
					ctx.error(new NonProductiveRuleIssue(
							NonProductiveRuleIssue.Reason.OPEN_BINDER_WITH_SEPARATOR, list.getLocation()));
					return null;
				}
				List<List<ProductionElement>> rest = alternatives(symbols, from + 1);
				return rest == null ? null : distribute(Collections.singletonList(
						new BinderListElement(variable, open, separator)), rest);
			}
			ctx.error(new NonProductiveRuleIssue(
					NonProductiveRuleIssue.Reason.INVALID_RECURSIVE_COMPONENT, list.getLocation()));
			return null;
		}

		/**
		 * Matches one more repetition of "separator variable" at index {@code from}, breaks being
		 * skipped on both sides. The variable must parse like the list elements.
		 *
		 * @return the index right after the repetition, or -1 if there is none
		 */
		private int matchTrailingPattern(List<NotationSymbol> symbols, int from, List<NotationSymbol> separator,
										 SubExpressionEntryType elementType) {
			int k = 0;
			int j = from;
			while (true) {
				NotationSymbol left = k < separator.size() ? separator.get(k) : null;
				NotationSymbol right = j < symbols.size() ? symbols.get(j) : null;
				if (left instanceof NotationTerminal && left.equals(right)) {
					k++;
					j++;
				} else if (left == null && right instanceof NotationVariable
						&& parsesLike(types.getType(((NotationVariable) right).getName()), elementType)) {
					return j + 1;
				} else if (left instanceof NotationBreak) {
					k++;
				} else if (right instanceof NotationBreak) {
					j++;
				} else {
					return -1;
				}
			}
		}

		private static boolean parsesLike(EntryType type, SubExpressionEntryType elementType) {
			if (!(type instanceof SubExpressionEntryType)) {
				return false;
			}
			SubExpressionEntryType sub = (SubExpressionEntryType) type;
			boolean comparable = !sub.getPosition().isBorder()
					|| sub.getLevel().getKind() != ProductionLevel.Kind.DEFAULT;
			return comparable && sub.getEntry().equals(elementType.getEntry())
					&& sub.getLevel().equals(elementType.getLevel());
		}

		private static List<List<ProductionElement>> expandList(String variable, ProductionEntry entry,
																List<TerminalElement> separator, int trailing,
																List<List<ProductionElement>> rest) {
			NonTerminalElement main = new NonTerminalElement(variable, entry);
			List<ProductionElement> unrolled = new ArrayList<>();
			for (int i = 0; i < trailing; i++) {
				unrolled.add(main);
				unrolled.addAll(separator);
			}

			List<ProductionElement> exact = new ArrayList<>();
			exact.add(new ListMark(trailing + 1, false, trailing));
			exact.addAll(unrolled);
			exact.add(main);

			List<ProductionElement> longer = new ArrayList<>();
			longer.add(new ListMark(trailing + 1, true, trailing));
			longer.addAll(unrolled);
			longer.add(main);
			longer.addAll(separator);
			longer.add(new ListElement(variable, entry, separator));

			List<List<ProductionElement>> result = new ArrayList<>(distribute(exact, rest));
			result.addAll(distribute(longer, rest));
			return result;
		}

		private static List<List<ProductionElement>> distribute(List<ProductionElement> prefix,
																List<List<ProductionElement>> alternatives) {
			List<List<ProductionElement>> result = new ArrayList<>();
			for (List<ProductionElement> alternative : alternatives) {
				List<ProductionElement> production = new ArrayList<>(prefix);
				production.addAll(alternative);
				result.add(production);
			}
			return result;
		}
	}
}
