package notasyn.printer;

import notasyn.model.unparsing.PrintingRule;

import java.util.List;
import java.util.Map;

/**
 * A term to print: either plain text, or a notation applied to the sub-terms bound to its variables.
 */
public abstract class PrintTree {

	/**
	 * @return the level the term is printed at, compared against the constraint of the place it is printed in
	 */
	public abstract int getLevel();

	public static PrintTree leaf(String text) {
		return new PrintLeaf(text, 0);
	}

	public static PrintTree leaf(String text, int level) {
		return new PrintLeaf(text, level);
	}

	/**
	 * @param arguments for each variable of the rule, the sub-terms it stands for: exactly one, or the
	 *                  elements of the list for a recursive variable
	 */
	public static PrintTree notation(PrintingRule rule, int level, Map<String, List<PrintTree>> arguments) {
		return new PrintNotation(rule, level, arguments);
	}
}
