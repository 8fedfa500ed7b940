package notasyn.trans.passes.parse.declaration;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import static notasyn.model.term.TermBuilder.*;

import java.io.File;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import org.json.JSONException;
import org.json.JSONObject;
import org.junit.Test;

import notasyn.errors.IssueWithContext;
import notasyn.errors.TopLevelIssueContext;
import notasyn.model.command.*;
import notasyn.model.notation.*;
import notasyn.model.term.NotationTerm;
import notasyn.trans.IOErrorIssue;
import notasyn.trans.WhileLoadingDeclaration;

public class DeclarationParsingPassTest {

	private static File fixture(String name) throws URISyntaxException {
		return new File(DeclarationParsingPassTest.class.getResource("/declarations/" + name).toURI());
	}

	@Test
	public void readsTheDeclarationFile() throws URISyntaxException {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<Command> commands = DeclarationParsingPass.perform(ctx, fixture("arith.json"));
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(commands.size(), is(10));

		assertThat(((DeclareScopeCommand) commands.get(0)).getScope(), is("nat_scope"));
		assertThat(((DeclareCustomEntryCommand) commands.get(1)).getName(), is("expr"));

		NotationDeclaration plus = ((NotationCommand) commands.get(2)).getDeclaration();
		assertThat(plus.getPattern(), is("x + y"));
		assertThat(plus.getModifiers().getLevel(), is(50));
		assertThat(plus.getModifiers().getAssociativity(), is(Associativity.LEFT));
		assertThat(plus.getScope(), is("nat_scope"));
		assertThat(plus.getInterpretation(), is((NotationTerm) app("plus", var("x"), var("y"))));

		InfixCommand mult = (InfixCommand) commands.get(3);
		assertThat(mult.getOperator(), is("*"));
		assertThat(mult.getHead(), is((NotationTerm) ref("mult")));

		NotationCommand reserved = (NotationCommand) commands.get(6);
		assertTrue(reserved.isReserved());
		NotationCommand interpretationOnly = (NotationCommand) commands.get(7);
		assertTrue(interpretationOnly.isInterpretationOnly());
		assertFalse(interpretationOnly.isReserved());

		NotationModifiers binder = ((NotationCommand) commands.get(8)).getDeclaration().getModifiers();
		assertThat(binder.getEntryTypes().get("b"), is((EntryType) new BinderEntryType(false)));
		assertThat(((NotationCommand) commands.get(9)).getDeclaration().getModifiers().getEntry(),
				is(NotationEntry.custom("expr")));
	}

	@Test
	public void missingFile() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertNull(DeclarationParsingPass.perform(ctx, new File("does/not/exist.json")));
		assertThat(ctx.getIssues().get(0), instanceOf(IOErrorIssue.class));
	}

	@Test
	public void invalidJson() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertNull(DeclarationParsingPass.parse(ctx, "broken.json", "{\"notations\": ["));
		assertThat(ctx.getIssues().get(0), instanceOf(DeclarationParsingIssue.class));
	}

	@Test
	public void invalidNotationIsReportedWithItsIndex() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String contents = "{\"notations\": [{\"pattern\": \"( x )\", \"interpretation\": \"x\"}, {\"pattern\": \"x + y\"}]}";
		assertNull(DeclarationParsingPass.parse(ctx, "decls.json", contents));
		assertThat(ctx.getIssues().size(), is(1));
		IssueWithContext issue = (IssueWithContext) ctx.getIssues().get(0);
		assertThat(((WhileLoadingDeclaration) issue.getContext()).getIndex(), is(1));
		assertThat(issue.unwrap(), instanceOf(DeclarationParsingIssue.class));
		assertThat(issue.getMessage(), containsString("while loading declaration 2 of decls.json"));
	}

	@Test
	public void entryTypes() {
		assertThat(DeclarationParsingPass.readEntryType("ident"), is((EntryType) new IdentEntryType()));
		assertThat(DeclarationParsingPass.readEntryType("binder"), is((EntryType) new BinderEntryType(true)));
		assertThat(DeclarationParsingPass.readEntryType("strict pattern at level 1"),
				is((EntryType) new PatternEntryType(true, 1)));
		assertThat(DeclarationParsingPass.readEntryType("pattern"), is((EntryType) new PatternEntryType(false, null)));
		assertThat(DeclarationParsingPass.readEntryType("constr at next level"),
				is((EntryType) new SubExpressionEntryType(NotationEntry.constr(), ProductionLevel.next(),
						ProductionPosition.internal())));
		assertThat(DeclarationParsingPass.readEntryType("custom expr at level 3"),
				is((EntryType) new SubExpressionEntryType(NotationEntry.custom("expr"), ProductionLevel.numeric(3),
						ProductionPosition.internal())));
	}

	@Test(expected = JSONException.class)
	public void unknownEntryType() {
		DeclarationParsingPass.readEntryType("ident at level 3");
	}

	@Test
	public void modifiers() {
		NotationModifiers modifiers = DeclarationParsingPass.readModifiers(new JSONObject(
				"{\"levels\": {\"x\": \"next\", \"y\": 30}, \"only_parsing\": true, \"extra\": {\"latex\": \"#1\"}}"));
		assertThat(modifiers.getVariableLevels().get("x"), is(ProductionLevel.next()));
		assertThat(modifiers.getVariableLevels().get("y"), is(ProductionLevel.numeric(30)));
		assertTrue(modifiers.isOnlyParsing());
		assertThat(modifiers.getExtra().get("latex"), is("#1"));
	}

	@Test
	public void terms() {
		HashSet<String> variables = new HashSet<>();
		variables.add("x");
		assertThat(DeclarationParsingPass.readTerm("x", variables), is((NotationTerm) var("x")));
		assertThat(DeclarationParsingPass.readTerm("zero", variables), is((NotationTerm) ref("zero")));
		assertThat(DeclarationParsingPass.readTerm(new JSONObject("{\"hole\": true}"), variables),
				is((NotationTerm) hole()));
		assertThat(DeclarationParsingPass.readTerm(new JSONObject("{\"app\": \"S\", \"args\": [\"x\"]}"), variables),
				is((NotationTerm) app("S", var("x"))));
	}

	@Test
	public void scopeKeysAndClasses() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<Command> commands = DeclarationParsingPass.parse(ctx, "scopes.json", "{\"scopes\": [\"nat_scope\"],"
				+ " \"delimiters\": {\"nat_scope\": \"nat\"}, \"bind_scopes\": {\"nat_scope\": [\"nat\", \"positive\"]}}");
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(commands.size(), is(3));
		DelimitScopeCommand delimit = (DelimitScopeCommand) commands.get(1);
		assertThat(delimit.getScope(), is("nat_scope"));
		assertThat(delimit.getKey(), is("nat"));
		BindScopeCommand bind = (BindScopeCommand) commands.get(2);
		assertThat(bind.getClasses(), is(Arrays.asList("nat", "positive")));

		commands = DeclarationParsingPass.parse(ctx, "undelimit.json", "{\"delimiters\": {\"nat_scope\": null}}");
		assertNull(((DelimitScopeCommand) commands.get(0)).getKey());
	}

	@Test
	public void deprecatedNotations() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<Command> commands = DeclarationParsingPass.parse(ctx, "deprecated.json", "{\"notations\": ["
				+ "{\"infix\": \"*\", \"level\": 40, \"head\": \"mult\", \"deprecated\": {\"since\": \"2.1\"}},"
				+ "{\"pattern\": \"x ** y\", \"level\": 40, \"interpretation\": {\"app\": \"mult\", \"args\": [\"x\", \"y\"]},"
				+ " \"deprecated\": {\"note\": \"use x * y\"}}]}");
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(((InfixCommand) commands.get(0)).getDeprecation(), is(new Deprecation("2.1", null)));
		assertThat(((NotationCommand) commands.get(1)).getDeclaration().getDeprecation(),
				is(new Deprecation(null, "use x * y")));
	}

	@Test
	public void abbreviations() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<Command> commands = DeclarationParsingPass.parse(ctx, "abbrev.json", "{\"abbreviations\": ["
				+ "{\"name\": \"twice\", \"params\": [\"n\"], \"body\": {\"app\": \"plus\", \"args\": [\"n\", \"n\"]},"
				+ " \"only_parsing\": true}]}");
		assertFalse(ctx.format(), ctx.hasErrors());
		AbbreviationCommand twice = (AbbreviationCommand) commands.get(0);
		assertThat(twice.getName(), is("twice"));
		assertThat(twice.getParameters(), is(Arrays.asList("n")));
		assertThat(twice.getBody(), is((NotationTerm) app("plus", var("n"), var("n"))));
		assertTrue(twice.isOnlyParsing());
		assertNull(twice.getDeprecation());

		assertNull(DeclarationParsingPass.parse(ctx, "abbrev.json",
				"{\"abbreviations\": [{\"name\": \"x + y\", \"body\": \"plus\"}]}"));
		assertThat(((IssueWithContext) ctx.getIssues().get(0)).unwrap(), instanceOf(DeclarationParsingIssue.class));
	}
}
