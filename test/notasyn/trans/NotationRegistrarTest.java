package notasyn.trans;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import static notasyn.model.term.TermBuilder.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import notasyn.errors.Issue;
import notasyn.model.notation.*;
import notasyn.model.term.NotationTerm;
import notasyn.model.unparsing.PrintingRule;
import notasyn.printer.NotationPrinter;
import notasyn.printer.PrintTree;
import notasyn.state.GrammarState;
import notasyn.trans.passes.compat.*;
import notasyn.trans.passes.decompose.CurlyBracketsIssue;
import notasyn.trans.passes.decompose.DuplicateVariableIssue;
import notasyn.trans.passes.entry.ModifierIssue;
import notasyn.trans.passes.precedence.AmbiguousLevelIssue;
import notasyn.trans.passes.printability.NonInjectiveInterpretationIssue;
import notasyn.trans.passes.printability.VariableBoundNotationIssue;

public class NotationRegistrarTest {

	private static final NotationKey PLUS = new NotationKey(NotationEntry.constr(), "_ + _");

	private GrammarState state;
	private NotationRegistrar registrar;

	@Before
	public void setUp() {
		state = new GrammarState();
		registrar = new NotationRegistrar(state);
	}

	private static NotationModifiers leftAt(int level) {
		return new NotationModifiers().atLevel(level).withAssociativity(Associativity.LEFT);
	}

	private static NotationDeclaration declaration(String pattern, NotationModifiers modifiers, NotationTerm term) {
		return new NotationDeclaration(pattern, modifiers, term, null, false);
	}

	private NotationInterpretation addPlus(int level) {
		return registrar.addNotation(declaration("x + y", leftAt(level), app("plus", var("x"), var("y"))));
	}

	private Issue rejected(Runnable registration) {
		try {
			registration.run();
		} catch (NotationRegistrationException e) {
			return e.getFirstIssue();
		}
		fail("the registration should have been rejected");
		return null;
	}

	private int productionsAt(int level) {
		return state.getGrammar().lookupEntry("constr").getLevels().get(level).getProductions().size();
	}

	@Test
	public void registersInfixNotation() {
		NotationInterpretation interpretation = addPlus(50);
		assertThat(interpretation.getKey(), is(PLUS));
		assertThat(interpretation.getUse(), is(NotationUse.PARSING_AND_PRINTING));
		assertThat(state.getNotations().getLevel(PLUS).getLevel(), is(50));
		assertNotNull(state.getNotations().getGrammarRule(PLUS));
		assertNotNull(state.getNotations().getPrintingRule(PLUS));
		assertThat(state.getNotations().getInterpretations(PLUS).size(), is(1));
		assertThat(productionsAt(50), is(1));
		assertTrue(state.getTokens().isKeyword("+"));
		assertThat(state.getLibrary().getLeaves().size(), is(2));
		assertTrue(registrar.getWarnings().isEmpty());
	}

	@Test
	public void printsWithAssociativity() {
		addPlus(50);
		PrintingRule rule = state.getNotations().getPrintingRule(PLUS).getRule();
		PrintTree a = PrintTree.leaf("a");
		PrintTree b = PrintTree.leaf("b");
		PrintTree c = PrintTree.leaf("c");
		NotationPrinter printer = new NotationPrinter(80);
		assertThat(printer.print(plus(rule, plus(rule, a, b), c)), is("a + b + c"));
		assertThat(printer.print(plus(rule, a, plus(rule, b, c))), is("a + (b + c)"));
	}

	private static PrintTree plus(PrintingRule rule, PrintTree x, PrintTree y) {
		Map<String, List<PrintTree>> arguments = new HashMap<>();
		arguments.put("x", Collections.singletonList(x));
		arguments.put("y", Collections.singletonList(y));
		return PrintTree.notation(rule, 50, arguments);
	}

	@Test
	public void leftRecursiveNotationNeedsALevel() {
		Issue issue = rejected(() -> registrar.addNotation(
				declaration("x + y", new NotationModifiers(), app("plus", var("x"), var("y")))));
		assertThat(issue, instanceOf(AmbiguousLevelIssue.class));
		assertTrue(state.getNotations().getKeys().isEmpty());
	}

	@Test
	public void closedNotationDefaultsToLevelZero() {
		registrar.addNotation(declaration("( x )", new NotationModifiers(), app("paren", var("x"))));
		NotationKey key = new NotationKey(NotationEntry.constr(), "( _ )");
		assertThat(state.getNotations().getLevel(key).getLevel(), is(0));
	}

	@Test
	public void duplicateVariable() {
		Issue issue = rejected(() -> registrar.addNotation(
				declaration("x x", new NotationModifiers().atLevel(1), app("twice", var("x")))));
		assertThat(issue, instanceOf(DuplicateVariableIssue.class));
	}

	@Test
	public void identicalRedeclarationIsAccepted() {
		addPlus(50);
		registrar.addNotation(declaration("x + y", leftAt(50), app("add", var("x"), var("y"))));
		assertThat(productionsAt(50), is(1));
		assertThat(state.getNotations().getInterpretations(PLUS).size(), is(2));
		assertTrue(registrar.getWarnings().isEmpty());
	}

	@Test
	public void levelCannotChange() {
		addPlus(50);
		Issue issue = rejected(() -> addPlus(60));
		assertThat(issue, instanceOf(IncompatibleLevelRedeclarationIssue.class));
		IncompatibleLevelRedeclarationIssue incompatible = (IncompatibleLevelRedeclarationIssue) issue;
		assertThat(incompatible.getPreviousLevel().getLevel(), is(50));
		assertThat(incompatible.getLevel().getLevel(), is(60));
		assertThat(state.getNotations().getLevel(PLUS).getLevel(), is(50));
		assertThat(state.getNotations().getInterpretations(PLUS).size(), is(1));
	}

	@Test
	public void stateIsRestoredAfterAFailure() {
		addPlus(50);
		int leaves = state.getLibrary().getLeaves().size();
		Issue issue = rejected(() -> registrar.addNotation(declaration("x 'minus' y",
				new NotationModifiers().atLevel(50).withAssociativity(Associativity.RIGHT),
				app("minus", var("x"), var("y")))));
		assertThat(issue, instanceOf(LevelAssociativityIssue.class));
		assertFalse(state.getTokens().isKeyword("minus"));
		assertThat(state.getNotations().getKeys(), is(Collections.singleton(PLUS)));
		assertThat(state.getLibrary().getLeaves().size(), is(leaves));
		assertThat(productionsAt(50), is(1));
	}

	@Test
	public void identifiersBecomeKeywords() {
		registrar.addNotation(declaration("'IF' c 'then' t 'else' e", new NotationModifiers().atLevel(200),
				app("ite", var("c"), var("t"), var("e"))));
		assertTrue(state.getTokens().isKeyword("IF"));
		assertTrue(state.getTokens().isKeyword("then"));
		assertTrue(state.getTokens().isKeyword("else"));
	}

	@Test
	public void changedFormatOverridesThePrintingRule() {
		addPlus(50);
		PrintingRule before = state.getNotations().getPrintingRule(PLUS).getRule();
		registrar.addNotation(declaration("x + y", leftAt(50).withFormat("x  +  /2 y"), app("plus", var("x"), var("y"))));
		assertThat(registrar.getWarnings().size(), is(1));
		assertThat(registrar.getWarnings().get(0).unwrap(), instanceOf(IncompatibleFormatRedeclarationIssue.class));
		assertThat(state.getNotations().getPrintingRule(PLUS).getRule(), not(before));
	}

	@Test
	public void bareVariableIsOnlyParsed() {
		NotationInterpretation interpretation = registrar.addNotation(
				declaration("{ x }", new NotationModifiers(), var("x")));
		assertThat(interpretation.getUse(), is(NotationUse.ONLY_PARSING));
		assertThat(registrar.getWarnings().size(), is(1));
		assertThat(registrar.getWarnings().get(0).unwrap(), instanceOf(VariableBoundNotationIssue.class));
	}

	@Test
	public void interpretationOfReservedNotation() {
		SyntaxExtension extension = registrar.addSyntaxExtension(
				NotationDeclaration.reserved("x ++ y", leftAt(60)));
		assertTrue(extension.getPrinting().isReserved());
		NotationInterpretation interpretation = registrar.addNotationInterpretation(
				declaration("x ++ y", new NotationModifiers(), app("append", var("x"), var("y"))));
		assertThat(interpretation.getUse(), is(NotationUse.PARSING_AND_PRINTING));
		assertThat(interpretation.getKey().getText(), is("_ ++ _"));
	}

	@Test
	public void interpretationOfPrintingOnlySyntaxIsOnlyPrinted() {
		registrar.addSyntaxExtension(NotationDeclaration.reserved("x ++ y", leftAt(60).onlyPrinting()));
		NotationKey key = new NotationKey(NotationEntry.constr(), "_ ++ _");
		assertNull(state.getNotations().getGrammarRule(key));

		NotationInterpretation interpretation = registrar.addNotationInterpretation(
				declaration("x ++ y", new NotationModifiers(), app("append", var("x"), var("y"))));
		assertThat(interpretation.getUse(), is(NotationUse.ONLY_PRINTING));

		NotationInterpretation reused = registrar.addNotation(
				declaration("x ++ y", new NotationModifiers(), app("concat", var("x"), var("y"))));
		assertThat(reused.getUse(), is(NotationUse.ONLY_PRINTING));
		assertNull(state.getNotations().getGrammarRule(key));
	}

	@Test
	public void interpretationNeedsASyntax() {
		Issue issue = rejected(() -> registrar.addNotationInterpretation(
				declaration("x ++ y", new NotationModifiers(), app("append", var("x"), var("y")))));
		assertThat(issue, instanceOf(NoSyntaxRuleIssue.class));
	}

	@Test
	public void infix() {
		NotationInterpretation interpretation = registrar.addInfix("*", leftAt(40), ref("mult"), null, false);
		assertThat(interpretation.getKey().getText(), is("_ * _"));
		assertThat(interpretation.getTerm(), is((NotationTerm) app(ref("mult"), var("x"), var("y"))));
	}

	@Test
	public void infixTakesNoEntryTypes() {
		Issue issue = rejected(() -> registrar.addInfix("*",
				leftAt(40).withEntryType("x", new IdentEntryType()), ref("mult"), null, false));
		assertThat(issue, instanceOf(ModifierIssue.class));
		assertThat(((ModifierIssue) issue).getReason(), is(ModifierIssue.Reason.ENTRY_TYPE_IN_INFIX));
	}

	@Test
	public void undeclaredScopeIsDeclaredWithAWarning() {
		registrar.addNotation(new NotationDeclaration("x + y", leftAt(50), app("plus", var("x"), var("y")),
				"nat_scope", false));
		assertTrue(state.getScopes().isDeclared("nat_scope"));
		assertThat(registrar.getWarnings().get(0).unwrap(), instanceOf(UndeclaredScopeIssue.class));
		assertNotNull(state.getNotations().getSpecificPrintingRule("nat_scope", PLUS));
	}

	@Test
	public void declaredScope() {
		registrar.declareScope("nat_scope", false);
		registrar.addNotation(new NotationDeclaration("x + y", leftAt(50), app("plus", var("x"), var("y")),
				"nat_scope", false));
		assertTrue(registrar.getWarnings().isEmpty());
	}

	@Test
	public void customEntries() {
		Issue unknown = rejected(() -> registrar.addNotation(declaration("[ x ]",
				new NotationModifiers().inCustomEntry("expr"), app("box", var("x")))));
		assertThat(unknown, instanceOf(UnknownCustomEntryIssue.class));

		registrar.declareCustomEntry("expr", false);
		assertNotNull(state.getGrammar().lookupEntry(NotationEntry.custom("expr").getGrammarName()));
		NotationInterpretation interpretation = registrar.addNotation(declaration("x & y",
				new NotationModifiers().inCustomEntry("expr").atLevel(3), app("and", var("x"), var("y"))));
		assertThat(interpretation.getKey().getEntry(), is(NotationEntry.custom("expr")));

		Issue exists = rejected(() -> registrar.declareCustomEntry("expr", false));
		assertThat(exists, instanceOf(CustomEntryExistsIssue.class));
	}

	@Test
	public void extraPrintingRule() {
		addPlus(50);
		PrintingRule rule = registrar.addExtraPrintingRule("x + y", NotationEntry.constr(), "latex", "#1 + #2");
		assertThat(rule.getExtra().get("latex"), is("#1 + #2"));
		assertThat(state.getNotations().getPrintingRule(PLUS).getRule().getExtra().get("latex"), is("#1 + #2"));

		Issue issue = rejected(() -> registrar.addExtraPrintingRule("x - y", NotationEntry.constr(), "latex", "-"));
		assertThat(issue, instanceOf(NoSyntaxRuleIssue.class));
	}

	@Test
	public void localDeclarationsAreNotKept() {
		registrar.addNotation(new NotationDeclaration("x + y", leftAt(50), app("plus", var("x"), var("y")),
				null, true));
		assertNotNull(state.getNotations().getLevel(PLUS));
		assertTrue(state.getLibrary().getLeaves().isEmpty());
	}

	@Test
	public void delimitingKeys() {
		registrar.declareScope("nat_scope", false);
		registrar.addDelimiters("nat_scope", "nat", false);
		assertThat(state.getScopes().getDelimiter("nat_scope"), is("nat"));
		assertThat(state.getScopes().getDelimitedScope("nat"), is("nat_scope"));
		assertTrue(registrar.getWarnings().isEmpty());

		registrar.addDelimiters("nat_scope", "N", false);
		ScopeDelimiterIssue overwritten = (ScopeDelimiterIssue) registrar.getWarnings().get(0).unwrap();
		assertThat(overwritten.getReason(), is(ScopeDelimiterIssue.Reason.OVERWRITTEN_KEY));
		assertThat(overwritten.getPrevious(), is("nat"));
		assertThat(state.getScopes().getDelimiter("nat_scope"), is("N"));
		assertThat(state.getScopes().getDelimitedScope("nat"), is("nat_scope"));

		registrar.declareScope("int_scope", false);
		registrar.addDelimiters("int_scope", "N", false);
		ScopeDelimiterIssue hidden = (ScopeDelimiterIssue) registrar.getWarnings().get(1).unwrap();
		assertThat(hidden.getReason(), is(ScopeDelimiterIssue.Reason.HIDDEN_BINDING));
		assertThat(hidden.getPrevious(), is("nat_scope"));
		assertThat(state.getScopes().getDelimitedScope("N"), is("int_scope"));
	}

	@Test
	public void removingAMissingKey() {
		registrar.declareScope("nat_scope", false);
		registrar.addDelimiters("nat_scope", "nat", false);
		registrar.removeDelimiters("nat_scope", false);
		assertNull(state.getScopes().getDelimiter("nat_scope"));
		int leaves = state.getLibrary().getLeaves().size();

		Issue issue = rejected(() -> registrar.removeDelimiters("nat_scope", false));
		assertThat(issue, instanceOf(ScopeDelimiterIssue.class));
		assertThat(((ScopeDelimiterIssue) issue).getReason(), is(ScopeDelimiterIssue.Reason.NO_KEY));
		assertThat(state.getLibrary().getLeaves().size(), is(leaves));
	}

	@Test
	public void classesBoundToAScope() {
		registrar.addClassScope("nat_scope", Arrays.asList("nat", "positive"), false);
		assertThat(registrar.getWarnings().get(0).unwrap(), instanceOf(UndeclaredScopeIssue.class));
		assertTrue(state.getScopes().isDeclared("nat_scope"));
		assertThat(state.getScopes().getClassScope("nat"), is("nat_scope"));
		assertThat(state.getScopes().getClassScope("positive"), is("nat_scope"));

		registrar.declareScope("pos_scope", false);
		registrar.addClassScope("pos_scope", Collections.singletonList("positive"), false);
		assertThat(state.getScopes().getClassScope("positive"), is("pos_scope"));
	}

	@Test
	public void curlyBracketsAreParsedAsTheirContents() {
		registrar.addSyntaxExtension(NotationDeclaration.reserved("{ x }", new NotationModifiers()));
		NotationInterpretation interpretation = registrar.addNotation(declaration("{ x } + { y }", leftAt(50),
				app("sumbool", var("x"), var("y"))));
		NotationKey key = new NotationKey(NotationEntry.constr(), "{ _ } + { _ }");
		assertThat(interpretation.getKey(), is(key));
		assertThat(state.getNotations().getGrammarRule(key).getKey().getText(), is("_ + _"));
		assertThat(state.getNotations().getPrintingRule(key).getRule().toString(), containsString("{"));
	}

	@Test
	public void curlyBracketsWithoutTheirRule() {
		Issue issue = rejected(() -> registrar.addNotation(declaration("{ x } + { y }", leftAt(50),
				app("sumbool", var("x"), var("y")))));
		assertThat(issue, instanceOf(CurlyBracketsIssue.class));
		assertTrue(state.getNotations().getKeys().isEmpty());
	}

	@Test
	public void abbreviations() {
		Abbreviation twice = registrar.addAbbreviation("twice", Collections.singletonList("n"),
				app("plus", var("n"), var("n")), false, null, false);
		assertFalse(twice.isOnlyParsing());
		assertThat(state.getNotations().getAbbreviation("twice"), is(twice));
		assertThat(state.getLibrary().getLeaves().size(), is(1));

		Abbreviation first = registrar.addAbbreviation("first", Collections.singletonList("a"), var("a"), false,
				new Deprecation("2.0", "use fst"), false);
		assertTrue(first.isOnlyParsing());
		assertThat(registrar.getWarnings().get(0).unwrap(), instanceOf(VariableBoundNotationIssue.class));
		assertThat(first.getDeprecation().getSince(), is("2.0"));

		Abbreviation left = registrar.addAbbreviation("left", Arrays.asList("a", "b"), app("inl", var("a")),
				false, null, false);
		assertTrue(left.isOnlyParsing());
		assertThat(registrar.getWarnings().get(1).unwrap(), instanceOf(NonInjectiveInterpretationIssue.class));
	}

	@Test
	public void deprecatedNotation() {
		Deprecation deprecation = new Deprecation("8.3", "use x * y");
		NotationInterpretation interpretation = registrar.addNotation(new NotationDeclaration("x ** y", leftAt(40),
				app("mult", var("x"), var("y")), null, false, deprecation));
		assertThat(interpretation.getDeprecation(), is(deprecation));
		NotationInterpretation infix = registrar.addInfix("*", leftAt(40), ref("mult"), null, false, deprecation);
		assertThat(infix.getDeprecation(), is(deprecation));
		assertNull(addPlus(50).getDeprecation());
	}
}
