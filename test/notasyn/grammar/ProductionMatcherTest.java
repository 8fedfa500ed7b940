package notasyn.grammar;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import static notasyn.model.term.TermBuilder.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import notasyn.model.grammar.GrammarRule;
import notasyn.model.grammar.Production;
import notasyn.model.notation.NotationDeclaration;
import notasyn.model.notation.NotationEntry;
import notasyn.model.notation.NotationKey;
import notasyn.model.notation.NotationModifiers;
import notasyn.model.term.NotationTerm;
import notasyn.state.GrammarState;
import notasyn.trans.NotationRegistrar;

/**
 * A recursive pattern followed by p repetitions of its separator and a variable parses lists of
 * at least p + 1 elements, each through exactly one production of its family.
 */
@RunWith(Parameterized.class)
public class ProductionMatcherTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				// pattern, trailing variables, elements
				{"[ x ; .. ; y ]", 0, 1},
				{"[ x ; .. ; y ]", 0, 2},
				{"[ x ; .. ; y ]", 0, 3},
				{"[ x ; .. ; y ]", 0, 5},
				{"[ x ; .. ; y ; z ]", 1, 2},
				{"[ x ; .. ; y ; z ]", 1, 3},
				{"[ x ; .. ; y ; z ]", 1, 5},
				{"[ x , .. , y , z , w ]", 2, 3},
				{"[ x , .. , y , z , w ]", 2, 5},
		});
	}

	private final String pattern;
	private final int trailing;
	private final int count;

	public ProductionMatcherTest(String pattern, int trailing, int count) {
		this.pattern = pattern;
		this.trailing = trailing;
		this.count = count;
	}

	private static String separatorOf(String pattern) {
		return pattern.split(" ")[2];
	}

	@Test
	public void test() {
		GrammarState state = new GrammarState();
		NotationTerm term = trailing == 0 ? app("list", var("x"))
				: trailing == 1 ? app("list", var("x"), var("z")) : app("list", var("x"), var("z"), var("w"));
		NotationKey key = new NotationRegistrar(state).addNotation(
				new NotationDeclaration(pattern, new NotationModifiers(), term, null, false)).getKey();
		assertThat(key.getEntry(), is(NotationEntry.constr()));
		GrammarRule rule = state.getNotations().getGrammarRule(key);
		assertThat(rule.getProductions().size(), is(2));

		String separator = separatorOf(pattern);
		List<String> elements = new ArrayList<>();
		List<String> tokens = new ArrayList<>();
		tokens.add("[");
		for (int i = 0; i < count; i++) {
			if (i > 0) {
				tokens.add(separator);
			}
			String element = "e" + i;
			elements.add(element);
			tokens.add(element);
		}
		tokens.add("]");

		ProductionMatcher matcher = ProductionMatcher.forKeywords(state.getTokens());
		List<Production> matching = matcher.matchingProductions(rule.getProductions(), tokens);
		assertThat(matching.size(), is(1));
		List<ProductionMatch> matches = matcher.matchAll(matching.get(0), tokens);
		assertThat(matches.size(), is(1));

		ListFolder.Fold fold = ListFolder.collect(matches.get(0));
		assertThat(fold.getElements(), is(elements.subList(0, count - trailing)));
		assertThat(fold.getTrailing(), is(elements.subList(count - trailing, count)));

		String folded = ListFolder.foldRight(fold.getElements(), "nil", (e, acc) -> "cons(" + e + ", " + acc + ")");
		assertThat(folded, startsWith("cons(e0, "));
	}

	@Test
	public void tooShortListsDoNotParse() {
		GrammarState state = new GrammarState();
		NotationTerm term = trailing == 0 ? app("list", var("x"))
				: trailing == 1 ? app("list", var("x"), var("z")) : app("list", var("x"), var("z"), var("w"));
		NotationKey key = new NotationRegistrar(state).addNotation(
				new NotationDeclaration(pattern, new NotationModifiers(), term, null, false)).getKey();
		List<Production> productions = state.getNotations().getGrammarRule(key).getProductions();
		ProductionMatcher matcher = ProductionMatcher.forKeywords(state.getTokens());
		assertTrue(matcher.matchingProductions(productions, Arrays.asList("[", "]")).isEmpty());
	}
}
