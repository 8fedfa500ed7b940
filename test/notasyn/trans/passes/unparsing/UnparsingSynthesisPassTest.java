package notasyn.trans.passes.unparsing;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import notasyn.errors.TopLevelIssueContext;
import notasyn.model.notation.*;
import notasyn.model.unparsing.*;
import notasyn.printer.NotationPrinter;
import notasyn.printer.PrintTree;
import notasyn.trans.passes.decompose.NotationDecompositionPass;
import notasyn.trans.passes.entry.EntryTypeResolutionPass;
import notasyn.trans.passes.entry.ResolvedEntryTypes;
import notasyn.trans.passes.precedence.NotationPrecedence;
import notasyn.trans.passes.precedence.PrecedenceResolutionPass;

public class UnparsingSynthesisPassTest {

	private static PrintingRule synthesize(TopLevelIssueContext ctx, String pattern, NotationModifiers modifiers) {
		DecomposedNotation notation = NotationDecompositionPass.perform(ctx, pattern, modifiers.getEntry(), false);
		Map<String, EntryType> overrides = EntryTypeResolutionPass.interpretModifiers(ctx, notation, modifiers);
		NotationPrecedence precedence = PrecedenceResolutionPass.perform(ctx, notation, modifiers, overrides);
		ResolvedEntryTypes types = EntryTypeResolutionPass.perform(ctx, notation, overrides, modifiers.getEntry(),
				precedence.getLevel(), precedence.getAssociativity());
		return UnparsingSynthesisPass.perform(ctx, notation, types, precedence.getLevel(), modifiers);
	}

	private static String print(PrintingRule rule, int width, String... leaves) {
		Map<String, List<PrintTree>> arguments = new HashMap<>();
		for (int i = 0; i + 1 < leaves.length; i += 2) {
			arguments.put(leaves[i], Collections.singletonList(PrintTree.leaf(leaves[i + 1])));
		}
		return new NotationPrinter(width).print(PrintTree.notation(rule, 50, arguments));
	}

	@Test
	public void bracketsHugTheirContents() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PrintingRule rule = synthesize(ctx, "( x )", new NotationModifiers());
		assertFalse(ctx.format(), ctx.hasErrors());
		List<UnparsingInstruction> instructions = rule.getInstructions();
		assertThat(instructions.size(), is(3));
		assertThat(instructions.get(0), is(new UnparsingLiteral("(")));
		assertThat(instructions.get(1), instanceOf(UnparsingMetaVariable.class));
		assertThat(instructions.get(2), is(new UnparsingLiteral(")")));
	}

	@Test
	public void operatorGetsABreakAfterIt() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PrintingRule rule = synthesize(ctx, "x + y", new NotationModifiers().atLevel(50));
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(rule.getInstructions().size(), is(1));
		UnparsingBox box = (UnparsingBox) rule.getInstructions().get(0);
		assertThat(box.getKind(), is(UnparsingBox.Kind.HOV));
		List<UnparsingInstruction> children = box.getChildren();
		assertThat(children.get(1), is(new UnparsingLiteral(" +")));
		assertThat(children.get(2), is(UnparsingCut.breakable(1, 0)));
		assertThat(print(rule, 80, "x", "a", "y", "b"), is("a + b"));
	}

	@Test
	public void keywordsAreSpaced() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PrintingRule rule = synthesize(ctx, "'if' c 'then' t 'else' e", new NotationModifiers().atLevel(200));
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(print(rule, 80, "c", "a", "t", "b", "e", "d"), is("if a then b else d"));
	}

	@Test
	public void formatPrintsLikeTheDefaultLayout() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PrintingRule heuristic = synthesize(ctx, "x + y", new NotationModifiers().atLevel(50));
		PrintingRule formatted = synthesize(ctx, "x + y", new NotationModifiers().atLevel(50).withFormat("x  +  /0 y"));
		assertFalse(ctx.format(), ctx.hasErrors());
		for (int width : Arrays.asList(80, 5, 4, 1)) {
			assertThat(print(formatted, width, "x", "ab", "y", "cd"), is(print(heuristic, width, "x", "ab", "y", "cd")));
		}
	}

	@Test
	public void formatBoxes() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PrintingRule rule = synthesize(ctx, "'begin' x 'end'",
				new NotationModifiers().withFormat("[v 0 'begin' // x // 'end' ]"));
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(print(rule, 80, "x", "body"), is("begin\nbody\nend"));
	}

	@Test
	public void formatIgnoredWhenOnlyParsing() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PrintingRule rule = synthesize(ctx, "( x )", new NotationModifiers().onlyParsing().withFormat("'(' [ x ] ')'"));
		assertFalse(ctx.hasErrors());
		assertThat(ctx.getWarnings().size(), is(1));
		assertThat(ctx.getWarnings().get(0), instanceOf(IgnoredFormatIssue.class));
		assertThat(rule.getInstructions().size(), is(3));
	}

	@Test
	public void formatMustFollowThePattern() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertNull(synthesize(ctx, "( x )", new NotationModifiers().withFormat("'[' x ')'")));
		assertThat(((FormatMismatchIssue) ctx.getIssues().get(0)).getReason(), is(FormatMismatchIssue.Reason.STRUCTURE));
	}

	@Test
	public void formatListSeparator() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PrintingRule rule = synthesize(ctx, "[ x ; .. ; y ]",
				new NotationModifiers().withFormat("'[' x ';'  /0 .. ';'  /0 y ']'"));
		assertFalse(ctx.format(), ctx.hasErrors());
		Map<String, List<PrintTree>> arguments = new HashMap<>();
		arguments.put("x", Arrays.asList(PrintTree.leaf("a"), PrintTree.leaf("b"), PrintTree.leaf("c")));
		assertThat(new NotationPrinter(80).print(PrintTree.notation(rule, 0, arguments)), is("[a; b; c]"));
	}

	private static FormatMismatchIssue.Reason listFormatMismatch(String format) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertNull(synthesize(ctx, "[ x ; .. ; y ]", new NotationModifiers().withFormat(format)));
		assertThat(ctx.getIssues().size(), is(1));
		return ((FormatMismatchIssue) ctx.getIssues().get(0)).getReason();
	}

	@Test
	public void listSeparatorsMustAgree() {
		assertThat(listFormatMismatch("'[' x ';' .. ',' y ']'"), is(FormatMismatchIssue.Reason.ELLIPSIS_SIDES));
		assertThat(listFormatMismatch("'[' x ';' .. ';' [ y ] ']'"), is(FormatMismatchIssue.Reason.ELLIPSIS_SIDES));
	}

	@Test
	public void ellipsisCannotBeNested() {
		assertThat(listFormatMismatch("'[' x [ ';' .. ] ';' .. ';' y ']'"), is(FormatMismatchIssue.Reason.ELLIPSIS_DEPTH));
	}
}
