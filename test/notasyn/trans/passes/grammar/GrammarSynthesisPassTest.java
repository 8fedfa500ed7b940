package notasyn.trans.passes.grammar;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import notasyn.errors.TopLevelIssueContext;
import notasyn.lexer.TokenTable;
import notasyn.model.grammar.*;
import notasyn.model.notation.*;
import notasyn.trans.passes.decompose.NotationDecompositionPass;
import notasyn.trans.passes.entry.EntryTypeResolutionPass;
import notasyn.trans.passes.entry.ResolvedEntryTypes;
import notasyn.trans.passes.precedence.NotationPrecedence;
import notasyn.trans.passes.precedence.PrecedenceResolutionPass;
import notasyn.util.SourceLocation;

public class GrammarSynthesisPassTest {

	private static GrammarRule synthesize(TopLevelIssueContext ctx, TokenTable keywords, String pattern,
										  NotationModifiers modifiers) {
		DecomposedNotation notation = NotationDecompositionPass.perform(ctx, pattern, modifiers.getEntry(), false);
		Map<String, EntryType> overrides = EntryTypeResolutionPass.interpretModifiers(ctx, notation, modifiers);
		assertNotNull(ctx.format(), overrides);
		NotationPrecedence precedence = PrecedenceResolutionPass.perform(ctx, notation, modifiers, overrides);
		assertNotNull(ctx.format(), precedence);
		ResolvedEntryTypes types = EntryTypeResolutionPass.perform(ctx, notation, overrides, modifiers.getEntry(),
				precedence.getLevel(), precedence.getAssociativity());
		assertNotNull(ctx.format(), types);
		return GrammarSynthesisPass.perform(ctx, keywords, notation, types, notation.getKey(modifiers.getEntry()),
				precedence.getLevel(), precedence.getAssociativity());
	}

	private static NonProductiveRuleIssue.Reason rejection(String pattern, NotationModifiers modifiers) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertNull(synthesize(ctx, new TokenTable(), pattern, modifiers));
		assertThat(ctx.getIssues().size(), is(1));
		return ((NonProductiveRuleIssue) ctx.getIssues().get(0)).getReason();
	}

	@Test
	public void onlyVariables() {
		assertThat(rejection("x y", new NotationModifiers().atLevel(10)), is(NonProductiveRuleIssue.Reason.NO_SYMBOL));
	}

	@Test
	public void startsWithList() {
		assertThat(rejection("x , .. , y", new NotationModifiers().atLevel(10)),
				is(NonProductiveRuleIssue.Reason.STARTS_WITH_RECURSIVE_LIST));
	}

	@Test
	public void onlyVariablesInCustomEntry() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		GrammarRule rule = synthesize(ctx, new TokenTable(), "x y", new NotationModifiers().inCustomEntry("expr").atLevel(10));
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(rule.getProductions().size(), is(1));
		assertThat(rule.getProductions().get(0).getElements().size(), is(2));
	}

	@Test
	public void binderLists() {
		assertThat(rejection("'fun' b , .. , c => t",
				new NotationModifiers().atLevel(200).withEntryType("b", new BinderEntryType(true))),
				is(NonProductiveRuleIssue.Reason.OPEN_BINDER_WITH_SEPARATOR));
		assertThat(rejection("'fun' b , .. , c => t",
				new NotationModifiers().atLevel(200).withEntryType("b", new IdentEntryType())),
				is(NonProductiveRuleIssue.Reason.INVALID_RECURSIVE_COMPONENT));

		TopLevelIssueContext ctx = new TopLevelIssueContext();
		GrammarRule rule = synthesize(ctx, new TokenTable(), "'fun' b , .. , c => t",
				new NotationModifiers().atLevel(200).withEntryType("b", new BinderEntryType(false)));
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(rule.getProductions().size(), is(1));
		ProductionElement list = rule.getProductions().get(0).getElements().get(1);
		assertThat(list, is((ProductionElement) new BinderListElement("b", false,
				Collections.singletonList(new TerminalElement(",", true)))));
	}

	@Test
	public void variableInSeparator() {
		SourceLocation nowhere = SourceLocation.unknown();
		List<NotationSymbol> symbols = Arrays.asList(
				new NotationTerminal(nowhere, "["),
				new NotationRecursiveList(nowhere, "x",
						Collections.<NotationSymbol>singletonList(new NotationVariable(nowhere, "z"))),
				new NotationTerminal(nowhere, "]"));
		DecomposedNotation notation = new DecomposedNotation("[ x z .. z y ]", symbols,
				Collections.singletonList("x"), Collections.<RecursiveVariablePair>emptyList(), false);
		Map<String, EntryType> types = Collections.singletonMap("x", (EntryType) new SubExpressionEntryType(
				NotationEntry.constr(), ProductionLevel.defaultLevel(), ProductionPosition.internal()));
		ResolvedEntryTypes resolved = new ResolvedEntryTypes(types, Collections.singletonList(types.get("x")),
				new Level(NotationEntry.constr(), 0,
						Collections.singletonList(PrecedenceConstraint.unconstrained())));

		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertNull(GrammarSynthesisPass.perform(ctx, new TokenTable(), notation, resolved,
				notation.getKey(NotationEntry.constr()), 0, Associativity.NON));
		assertThat(((NonProductiveRuleIssue) ctx.getIssues().get(0)).getReason(),
				is(NonProductiveRuleIssue.Reason.NON_TERMINAL_IN_SEPARATOR));
	}

	@Test
	public void identifiersAfterSubExpressionsBecomeKeywords() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		TokenTable keywords = new TokenTable();
		GrammarRule rule = synthesize(ctx, keywords, "'IF' c 'then' t 'else' e", new NotationModifiers().atLevel(200));
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(keywords.getKeywords(), hasItems("IF", "then", "else"));
		List<ProductionElement> elements = rule.getProductions().get(0).getElements();
		assertThat(elements.get(2), is((ProductionElement) new TerminalElement("then", true)));
	}

	@Test
	public void identifierAfterIdentStaysAnIdentifier() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		TokenTable keywords = new TokenTable();
		GrammarRule rule = synthesize(ctx, keywords, "'fun' i 'in' t",
				new NotationModifiers().atLevel(200).withEntryType("i", new IdentEntryType()));
		assertFalse(ctx.format(), ctx.hasErrors());
		assertTrue(keywords.isKeyword("fun"));
		assertFalse(keywords.isKeyword("in"));
		assertThat(rule.getProductions().get(0).getElements().get(2), is((ProductionElement) new TerminalElement("in", false)));
	}

	@Test
	public void trailingElementUnrolledWhenItParsesLikeTheList() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		GrammarRule rule = synthesize(ctx, new TokenTable(), "[ x ; .. ; y ; z ]", new NotationModifiers());
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(rule.getProductions().size(), is(2));
		ListMark mark = (ListMark) rule.getProductions().get(0).getElements().get(1);
		assertThat(mark.getCount(), is(2));
		assertThat(mark.getTrailing(), is(1));
		assertFalse(mark.isContinued());
		assertTrue(((ListMark) rule.getProductions().get(1).getElements().get(1)).isContinued());
	}

	@Test
	public void trailingElementAtAnotherLevelIsKept() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		GrammarRule rule = synthesize(ctx, new TokenTable(), "[ x ; .. ; y ; z ]",
				new NotationModifiers().withVariableLevel("z", ProductionLevel.numeric(10)));
		assertFalse(ctx.format(), ctx.hasErrors());
		ListMark mark = (ListMark) rule.getProductions().get(0).getElements().get(1);
		assertThat(mark.getCount(), is(1));
		assertThat(mark.getTrailing(), is(0));
	}
}
