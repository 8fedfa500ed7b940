package notasyn.printer;

import notasyn.model.notation.PrecedenceConstraint;
import notasyn.model.unparsing.PrintingRule;

/**
 * Prints terms with the printing rules of their notations.
 *
 * <pre>
 * NotationPrinter printer = new NotationPrinter(80);
 * printer.print(PrintTree.notation(plusRule, 50, arguments));
 * </pre>
 */
public class NotationPrinter {

	private final int width;

	public NotationPrinter(int width) {
		if (width <= 0) {
			throw new IllegalArgumentException("width must be positive, got " + width);
		}
		this.width = width;
	}

	public int getWidth() {
		return width;
	}

	public String print(PrintTree tree) {
		return new BoxRenderer(width).render(LayoutBuilder.layoutTree(tree, PrecedenceConstraint.unconstrained()));
	}

	/**
	 * Prints a rule on its own, each variable standing for itself.
	 */
	public String printRule(PrintingRule rule) {
		return new BoxRenderer(width).render(new LayoutBuilder(null).layoutAll(rule.getInstructions()));
	}
}
