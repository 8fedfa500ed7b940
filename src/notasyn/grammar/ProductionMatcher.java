package notasyn.grammar;

import notasyn.lexer.KeywordTable;
import notasyn.model.grammar.*;
import notasyn.model.notation.NotationTokens;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Runs a production over a list of tokens, where every non-terminal slot matches exactly one
 * atom token. Enumerates every way the production matches, so that ambiguities between the
 * productions of one family can be observed.
 */
public class ProductionMatcher {

	private final Predicate<String> isAtom;

	public ProductionMatcher(Predicate<String> isAtom) {
		this.isAtom = isAtom;
	}

	/**
	 * A matcher whose atoms are the identifiers and numerals that are not keywords.
	 */
	public static ProductionMatcher forKeywords(KeywordTable keywords) {
		return new ProductionMatcher(token -> !keywords.isKeyword(token)
				&& (NotationTokens.isIdent(token) || NotationTokens.isUnsignedNumeral(token)));
	}

	public List<ProductionMatch> matchAll(Production production, List<String> tokens) {
		List<ProductionMatch> matches = new ArrayList<>();
		match(production.getElements(), 0, tokens, 0, new ArrayList<>(), 0, null, matches);
		return matches;
	}

	/**
	 * @return the productions of the family that match the tokens in at least one way
	 */
	public List<Production> matchingProductions(List<Production> family, List<String> tokens) {
		List<Production> matching = new ArrayList<>();
		for (Production production : family) {
			if (!matchAll(production, tokens).isEmpty()) {
				matching.add(production);
			}
		}
		return matching;
	}

	private void match(List<ProductionElement> elements, int e, List<String> tokens, int t,
					   List<ProductionMatch.Capture> captures, int listed, ListMark mark, List<ProductionMatch> out) {
		if (e == elements.size()) {
			if (t == tokens.size()) {
				out.add(new ProductionMatch(new ArrayList<>(captures), mark));
			}
			return;
		}
		ProductionElement element = elements.get(e);
		if (element instanceof TerminalElement) {
			if (t < tokens.size() && tokens.get(t).equals(((TerminalElement) element).getText())) {
				match(elements, e + 1, tokens, t + 1, captures, listed, mark, out);
			}
		} else if (element instanceof ListMark) {
			ListMark listMark = (ListMark) element;
			match(elements, e + 1, tokens, t, captures, listMark.getCount(), listMark, out);
		} else if (element instanceof NonTerminalElement) {
			if (t < tokens.size() && isAtom.test(tokens.get(t))) {
				captures.add(new ProductionMatch.Capture(
						((NonTerminalElement) element).getVariable(), tokens.get(t), listed > 0));
				match(elements, e + 1, tokens, t + 1, captures, Math.max(listed - 1, 0), mark, out);
				captures.remove(captures.size() - 1);
			}
		} else if (element instanceof ListElement) {
			ListElement list = (ListElement) element;
			boolean listedElements = mark != null && mark.isContinued();
			matchRepeated(elements, e, list.getVariable(), list.getSeparator(), listedElements, tokens, t,
					captures, listed, mark, out);
		} else if (element instanceof BinderListElement) {
			BinderListElement binders = (BinderListElement) element;
			matchRepeated(elements, e, binders.getVariable(), binders.getSeparator(), false, tokens, t,
					captures, listed, mark, out);
		}
	}

	private void matchRepeated(List<ProductionElement> elements, int e, String variable, List<TerminalElement> separator,
							   boolean listedElements, List<String> tokens, int t, List<ProductionMatch.Capture> captures,
							   int listed, ListMark mark, List<ProductionMatch> out) {
		if (t >= tokens.size() || !isAtom.test(tokens.get(t))) {
			return;
		}
		captures.add(new ProductionMatch.Capture(variable, tokens.get(t), listedElements));
		match(elements, e + 1, tokens, t + 1, captures, listed, mark, out);
		int next = t + 1;
		boolean separated = true;
		for (TerminalElement terminal : separator) {
			if (next >= tokens.size() || !tokens.get(next).equals(terminal.getText())) {
				separated = false;
				break;
			}
			next++;
		}
		if (separated) {
			matchRepeated(elements, e, variable, separator, listedElements, tokens, next, captures, listed, mark, out);
		}
		captures.remove(captures.size() - 1);
	}
}
