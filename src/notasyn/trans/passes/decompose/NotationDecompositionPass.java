package notasyn.trans.passes.decompose;

import notasyn.errors.IssueContext;
import notasyn.model.notation.*;
import notasyn.util.SourceLocation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits a notation pattern into symbols. Tokens are separated by single blanks, and every extra
 * blank of a run becomes part of a break. Identifiers are variables, `..` introduces a recursive
 * pattern, and everything else is a terminal, single quotes being stripped from quoted ones.
 */
public class NotationDecompositionPass {

	static final String ELLIPSIS = "..";

	/**
	 * The key of the notation "{ x }", which parses the braces of every other "{ x }".
	 */
	public static final NotationKey CURLY_BRACKETS = new NotationKey(NotationEntry.constr(), "{ _ }");

	private NotationDecompositionPass() {}

	public static DecomposedNotation perform(IssueContext ctx, String pattern, NotationEntry entry, boolean onlyPrinting) {
		List<NotationSymbol> raw = split(ctx, pattern);
		if (raw == null) {
			return null;
		}
		if (!checkDuplicates(ctx, raw, onlyPrinting)) {
			return null;
		}

		List<RecursiveVariablePair> pairs = new ArrayList<>();
		List<NotationSymbol> symbols = foldRecursivePatterns(ctx, raw, pairs);
		if (symbols == null) {
			return null;
		}

		List<String> mainVariables = new ArrayList<>();
		for (NotationSymbol symbol : symbols) {
			if (symbol instanceof NotationVariable) {
				mainVariables.add(((NotationVariable) symbol).getName());
			} else if (symbol instanceof NotationRecursiveList) {
				mainVariables.add(((NotationRecursiveList) symbol).getVariable());
			}
		}

		boolean numeral = !entry.isCustom() && isNumeral(symbols);
		return new DecomposedNotation(pattern, symbols, mainVariables, pairs, numeral);
	}

	private static List<NotationSymbol> split(IssueContext ctx, String pattern) {
		List<NotationSymbol> symbols = new ArrayList<>();
		boolean failed = false;
		int length = pattern.length();
		int i = 0;
		while (i < length && pattern.charAt(i) == ' ') {
			i++;
		}
		while (i < length) {
			int start = i;
			while (i < length && pattern.charAt(i) != ' ') {
				i++;
			}
			NotationSymbol token = classify(ctx, pattern, start, i);
			if (token == null) {
				failed = true;
			} else {
				symbols.add(token);
			}
			int blanks = i;
			while (i < length && pattern.charAt(i) == ' ') {
				i++;
			}
			if (i < length && i - blanks > 1) {
				symbols.add(new NotationBreak(new SourceLocation(pattern, blanks + 1, i), i - blanks - 1));
			}
		}
		return failed ? null : symbols;
	}

	private static NotationSymbol classify(IssueContext ctx, String pattern, int start, int end) {
		SourceLocation location = new SourceLocation(pattern, start, end);
		String token = pattern.substring(start, end);
		if (token.equals(ELLIPSIS)) {
			return new NotationVariable(location, ELLIPSIS);
		}
		if (token.equals("_")) {
			ctx.error(new RecursivePatternIssue(RecursivePatternIssue.Reason.UNQUOTED_UNDERSCORE, location));
			return null;
		}
		if (NotationTokens.isIdent(token)) {
			return new NotationVariable(location, token);
		}
		if (token.length() > 2 && token.startsWith("'") && token.endsWith("'")) {
			token = token.substring(1, token.length() - 1);
		}
		return new NotationTerminal(location, token);
	}

	private static boolean isEllipsis(NotationSymbol symbol) {
		return symbol instanceof NotationVariable && ((NotationVariable) symbol).getName().equals(ELLIPSIS);
	}

	private static boolean checkDuplicates(IssueContext ctx, List<NotationSymbol> raw, boolean onlyPrinting) {
		if (onlyPrinting) {
			return true;
		}
		Set<String> seen = new HashSet<>();
		boolean ok = true;
		for (NotationSymbol symbol : raw) {
			if (symbol instanceof NotationVariable && !isEllipsis(symbol)) {
				String name = ((NotationVariable) symbol).getName();
				if (!seen.add(name)) {
					ctx.error(new DuplicateVariableIssue(name, symbol.getLocation()));
					ok = false;
				}
			}
		}
		return ok;
	}

	/**
	 * Replaces every "x sep .. sep y" with a recursive list of x separated by sep, recording the
	 * pair (x, y). The separator is what lies between x and the ellipsis, and it must be repeated
	 * identically right after the ellipsis.
	 */
	private static List<NotationSymbol> foldRecursivePatterns(IssueContext ctx, List<NotationSymbol> raw,
															  List<RecursiveVariablePair> pairs) {
		List<NotationSymbol> out = new ArrayList<>();
		int lastVariable = -1;
		for (int i = 0; i < raw.size(); i++) {
			NotationSymbol symbol = raw.get(i);
			if (isEllipsis(symbol)) {
				if (lastVariable < 0) {
					ctx.error(new RecursivePatternIssue(
							RecursivePatternIssue.Reason.NO_VARIABLE_BEFORE_ELLIPSIS, symbol.getLocation()));
					return null;
				}
				NotationVariable first = (NotationVariable) out.get(lastVariable);
				List<NotationSymbol> separator = new ArrayList<>(out.subList(lastVariable + 1, out.size()));
				int last = matchSeparator(ctx, symbol, separator, raw, i + 1);
				if (last < 0) {
					return null;
				}
				NotationVariable closing = (NotationVariable) raw.get(last);
				out.subList(lastVariable, out.size()).clear();
				out.add(new NotationRecursiveList(
						first.getLocation().combine(closing.getLocation()), first.getName(), separator));
				pairs.add(new RecursiveVariablePair(first.getName(), closing.getName()));
				lastVariable = -1;
				i = last;
			} else if (symbol instanceof NotationVariable) {
				out.add(symbol);
				lastVariable = out.size() - 1;
			} else {
				out.add(symbol);
			}
		}
		return out;
	}

	/**
	 * @return the index in raw of the variable closing the recursive pattern, or -1 after
	 * reporting an issue
	 */
	private static int matchSeparator(IssueContext ctx, NotationSymbol ellipsis, List<NotationSymbol> separator,
									  List<NotationSymbol> raw, int from) {
		int k = 0;
		int j = from;
		while (true) {
			NotationSymbol left = k < separator.size() ? separator.get(k) : null;
			NotationSymbol right = j < raw.size() ? raw.get(j) : null;
			if (left != null && left.equals(right)) {
				k++;
				j++;
				continue;
			}
			if (left == null && right instanceof NotationVariable && !isEllipsis(right)) {
				return j;
			}
			if (right instanceof NotationBreak || left instanceof NotationBreak) {
				NotationSymbol culprit = right instanceof NotationBreak ? right : left;
				ctx.error(new RecursivePatternIssue(RecursivePatternIssue.Reason.ONE_SIDED_BREAK, culprit.getLocation()));
				return -1;
			}
			if (right instanceof NotationTerminal || left instanceof NotationTerminal) {
				NotationSymbol culprit = right instanceof NotationTerminal ? right : left;
				ctx.error(new RecursivePatternIssue(RecursivePatternIssue.Reason.ONE_SIDED_TOKEN, culprit.getLocation()));
				return -1;
			}
			ctx.error(new RecursivePatternIssue(RecursivePatternIssue.Reason.EXPECTED_RECURSIVE_FORM,
					right == null ? ellipsis.getLocation() : right.getLocation()));
			return -1;
		}
	}

	/**
	 * Reduces every "{ x }" of a larger pattern to x, for the grammar of the pattern: the braces
	 * are parsed by the notation "{ x }" itself. Breaks around x are dropped with the braces.
	 *
	 * @param bracketsParsed whether the notation "{ x }" has a grammar rule
	 * @return the notation to build the grammar from, the given one when there is nothing to reduce,
	 * or null after reporting an issue
	 */
	public static DecomposedNotation squashCurlyBrackets(IssueContext ctx, DecomposedNotation notation,
														 boolean bracketsParsed) {
		List<NotationSymbol> symbols = notation.getSymbols();
		List<NotationSymbol> squashed = new ArrayList<>();
		int i = 0;
		while (i < symbols.size()) {
			NotationSymbol symbol = symbols.get(i);
			if (isTerminal(symbol, "{")) {
				int variable = skipBreaks(symbols, i + 1);
				if (variable < symbols.size() && symbols.get(variable) instanceof NotationVariable) {
					int close = skipBreaks(symbols, variable + 1);
					if (close < symbols.size() && isTerminal(symbols.get(close), "}")) {
						if (i == 0 && close == symbols.size() - 1) {
							return notation;
						}
						squashed.add(symbols.get(variable));
						i = close + 1;
						continue;
					}
				}
			}
			squashed.add(symbol);
			i++;
		}
		if (squashed.size() == symbols.size()) {
			return notation;
		}
		if (!bracketsParsed) {
			ctx.error(new CurlyBracketsIssue(SourceLocation.wholeOf(notation.getPattern())));
			return null;
		}
		return new DecomposedNotation(notation.getPattern(), squashed, notation.getMainVariables(),
				notation.getRecursivePairs(), notation.isNumeral());
	}

	private static boolean isTerminal(NotationSymbol symbol, String text) {
		return symbol instanceof NotationTerminal && ((NotationTerminal) symbol).getText().equals(text);
	}

	private static int skipBreaks(List<NotationSymbol> symbols, int from) {
		int i = from;
		while (i < symbols.size() && symbols.get(i) instanceof NotationBreak) {
			i++;
		}
		return i;
	}

	private static boolean isNumeral(List<NotationSymbol> symbols) {
		List<String> terminals = new ArrayList<>();
		for (NotationSymbol symbol : symbols) {
			if (symbol instanceof NotationBreak) {
				continue;
			}
			if (!(symbol instanceof NotationTerminal)) {
				return false;
			}
			terminals.add(((NotationTerminal) symbol).getText());
		}
		if (terminals.size() == 1) {
			return NotationTokens.isUnsignedNumeral(terminals.get(0));
		}
		return terminals.size() == 2 && terminals.get(0).equals("-") && NotationTokens.isUnsignedNumeral(terminals.get(1));
	}
}
