package notasyn.printer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import notasyn.model.notation.PrecedenceConstraint;
import notasyn.model.unparsing.*;

public class NotationPrinterTest {

	// x + y at level 50, left associative
	private static final PrintingRule PLUS = new PrintingRule(Collections.singletonList(
			new UnparsingBox(UnparsingBox.Kind.HOV, 0, Arrays.asList(
					new UnparsingMetaVariable("x", PrecedenceConstraint.atMost(50)),
					new UnparsingLiteral(" +"),
					UnparsingCut.breakable(1, 0),
					new UnparsingMetaVariable("y", PrecedenceConstraint.strictlyBelow(50))))),
			Collections.emptyMap());

	private static PrintTree plus(PrintTree x, PrintTree y) {
		Map<String, List<PrintTree>> arguments = new HashMap<>();
		arguments.put("x", Collections.singletonList(x));
		arguments.put("y", Collections.singletonList(y));
		return PrintTree.notation(PLUS, 50, arguments);
	}

	private static PrintTree leaf(String text) {
		return PrintTree.leaf(text);
	}

	private static PrintTree leaf(String text, int level) {
		return PrintTree.leaf(text, level);
	}

	@Test
	public void fitsOnOneLine() {
		assertThat(new NotationPrinter(80).print(plus(leaf("a"), leaf("b"))), is("a + b"));
	}

	@Test
	public void parenthesizesByLevel() {
		NotationPrinter printer = new NotationPrinter(80);
		assertThat(printer.print(plus(plus(leaf("a"), leaf("b")), leaf("c"))), is("a + b + c"));
		assertThat(printer.print(plus(leaf("a"), plus(leaf("b"), leaf("c")))), is("a + (b + c)"));
		assertThat(printer.print(plus(leaf("f x", 10), leaf("g y", 60))), is("f x + (g y)"));
	}

	@Test
	public void breaksWhenTooWide() {
		assertThat(new NotationPrinter(8).print(plus(leaf("aaaa"), leaf("bbbb"))), is("aaaa +\nbbbb"));
		assertThat(new NotationPrinter(11).print(plus(leaf("aaaa"), leaf("bbbb"))), is("aaaa + bbbb"));
	}

	@Test
	public void hvBoxBreaksEverywhere() {
		PrintingRule rule = new PrintingRule(Collections.singletonList(
				new UnparsingBox(UnparsingBox.Kind.HV, 2, Arrays.asList(
						new UnparsingLiteral("begin"),
						UnparsingCut.breakable(1, 0),
						new UnparsingLiteral("x"),
						UnparsingCut.breakable(1, 0),
						new UnparsingLiteral("end")))),
				Collections.emptyMap());
		assertThat(new NotationPrinter(80).printRule(rule), is("begin x end"));
		assertThat(new NotationPrinter(8).printRule(rule), is("begin\n  x\n  end"));
	}

	@Test
	public void forcedNewline() {
		PrintingRule rule = new PrintingRule(Arrays.asList(
				new UnparsingLiteral("a"), UnparsingCut.forcedNewline(), new UnparsingLiteral("b")),
				Collections.emptyMap());
		assertThat(new NotationPrinter(80).printRule(rule), is("a\nb"));
	}

	@Test
	public void listsAndRulesOnTheirOwn() {
		PrintingRule rule = new PrintingRule(Arrays.asList(
				new UnparsingLiteral("["),
				new UnparsingListMetaVariable("x", PrecedenceConstraint.unconstrained(),
						Arrays.asList(new UnparsingLiteral(";"), UnparsingCut.breakable(1, 0))),
				new UnparsingLiteral("]")),
				Collections.emptyMap());
		assertThat(new NotationPrinter(80).printRule(rule), is("[x; ..]"));
		assertThat(new NotationPrinter(80).printRule(PLUS), is("x + y"));

		Map<String, List<PrintTree>> arguments = new HashMap<>();
		arguments.put("x", Arrays.asList(leaf("1"), leaf("2"), leaf("3")));
		assertThat(new NotationPrinter(80).print(PrintTree.notation(rule, 0, arguments)), is("[1; 2; 3]"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void missingArgument() {
		new NotationPrinter(80).print(PrintTree.notation(PLUS, 50, Collections.emptyMap()));
	}

	@Test(expected = IllegalArgumentException.class)
	public void widthMustBePositive() {
		new NotationPrinter(0);
	}
}
