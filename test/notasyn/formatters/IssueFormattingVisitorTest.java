package notasyn.formatters;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import static notasyn.model.term.TermBuilder.*;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import notasyn.errors.Issue;
import notasyn.errors.TopLevelIssueContext;
import notasyn.model.notation.Associativity;
import notasyn.model.notation.Deprecation;
import notasyn.model.notation.NotationDeclaration;
import notasyn.model.notation.NotationModifiers;
import notasyn.printer.NotationPrinter;
import notasyn.state.GrammarState;
import notasyn.trans.NotationRegistrar;
import notasyn.trans.WhileLoadingDeclaration;
import notasyn.trans.WhileRegisteringNotation;
import notasyn.trans.passes.compat.ScopeDelimiterIssue;
import notasyn.trans.passes.compat.UndeclaredScopeIssue;
import notasyn.trans.passes.decompose.CurlyBracketsIssue;
import notasyn.trans.passes.decompose.DuplicateVariableIssue;
import notasyn.trans.passes.printability.NonInjectiveInterpretationIssue;
import notasyn.util.SourceLocation;

public class IssueFormattingVisitorTest {

	private static String format(Issue issue) {
		StringWriter sw = new StringWriter();
		try {
			issue.accept(new IssueFormattingVisitor(new IndentingWriter(sw, 2, "\n")));
		} catch (IOException e) {
			throw new AssertionError(e);
		}
		return sw.toString();
	}

	@Test
	public void pointsAtTheLocation() {
		String text = format(new DuplicateVariableIssue("x", new SourceLocation("x + x", 4, 5)));
		assertThat(text, is("variable x occurs more than once at 5 in \"x + x\"\nx + x\n    ^"));
	}

	@Test
	public void unknownLocationsAreLeftOut() {
		String text = format(new NonInjectiveInterpretationIssue(Arrays.asList("y", "z"), SourceLocation.unknown()));
		assertThat(text, is("the interpretation does not mention y, z: the notation will not be used for printing"));
	}

	@Test
	public void contextsAreNested() {
		Issue issue = new UndeclaredScopeIssue("nat_scope")
				.withContext(new WhileRegisteringNotation("x + y"))
				.withContext(new WhileLoadingDeclaration("decls.json", 0));
		assertThat(format(issue), is("while loading declaration 1 of decls.json\n"
				+ "  while registering \"x + y\"\n"
				+ "    scope nat_scope was not declared, declaring it"));
	}

	@Test
	public void countsTopLevelIssues() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ctx.error(new UndeclaredScopeIssue("a"));
		ctx.error(new UndeclaredScopeIssue("b"));
		assertThat(ctx.format(), startsWith("Detected 2 issue(s):"));
		assertThat(ctx.format(), containsString("scope b was not declared"));
	}

	@Test
	public void writesTheRegisteredNotations() throws IOException {
		GrammarState state = new GrammarState();
		new NotationRegistrar(state).addNotation(new NotationDeclaration("x + y",
				new NotationModifiers().atLevel(50).withAssociativity(Associativity.LEFT),
				app("plus", var("x"), var("y")), null, false));
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw, 2, "\n");
		GrammarStateFormatter.format(out, state, new NotationPrinter(80));
		String text = sw.toString();
		assertThat(text, startsWith("Keywords:"));
		assertThat(text, containsString(" +"));
		assertThat(text, containsString("Notation \"_ + _\" at level 50"));
		assertThat(text, containsString("renders as: x + y"));
		assertThat(text, containsString("interpretation: "));
	}

	@Test
	public void scopeKeys() {
		assertThat(format(new ScopeDelimiterIssue(ScopeDelimiterIssue.Reason.OVERWRITTEN_KEY, "nat_scope", "N", "nat")),
				is("overwriting delimiting key nat of scope nat_scope with N"));
		assertThat(format(new ScopeDelimiterIssue(ScopeDelimiterIssue.Reason.HIDDEN_BINDING, "int_scope", "N", "nat_scope")),
				is("hiding binding of key N to scope nat_scope"));
		assertThat(format(new ScopeDelimiterIssue(ScopeDelimiterIssue.Reason.NO_KEY, "nat_scope", null, null)),
				is("no delimiting key bound to scope nat_scope"));
		assertThat(format(new CurlyBracketsIssue(SourceLocation.unknown())), containsString("\"{ x }\""));
	}

	@Test
	public void stateWithScopeKeysAndAbbreviations() throws IOException {
		GrammarState state = new GrammarState();
		NotationRegistrar registrar = new NotationRegistrar(state);
		registrar.declareScope("nat_scope", false);
		registrar.addDelimiters("nat_scope", "nat", false);
		registrar.addClassScope("nat_scope", Collections.singletonList("nat"), false);
		registrar.addInfix("+", new NotationModifiers().atLevel(50).withAssociativity(Associativity.LEFT),
				ref("plus"), "nat_scope", false, new Deprecation("2.0", null));
		registrar.addAbbreviation("one", Collections.emptyList(), app("S", ref("O")), true, null, false);
		StringWriter sw = new StringWriter();
		GrammarStateFormatter.format(new IndentingWriter(sw, 2, "\n"), state, new NotationPrinter(80));
		String text = sw.toString();
		assertThat(text, containsString("Scopes: nat_scope%nat"));
		assertThat(text, containsString("Classes: nat -> nat_scope"));
		assertThat(text, containsString("deprecated since 2.0"));
		assertThat(text, containsString("Abbreviation one := "));
		assertThat(text, containsString("(only parsing)"));
	}
}
