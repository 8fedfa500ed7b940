package notasyn.model.notation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A notation pattern split into symbols, together with the variable bookkeeping needed by
 * the later stages.
 */
public final class DecomposedNotation {

	private final String pattern;
	private final List<NotationSymbol> symbols;
	private final List<String> mainVariables;
	private final List<RecursiveVariablePair> recursivePairs;
	private final boolean numeral;

	public DecomposedNotation(String pattern, List<NotationSymbol> symbols, List<String> mainVariables,
							  List<RecursiveVariablePair> recursivePairs, boolean numeral) {
		this.pattern = pattern;
		this.symbols = Collections.unmodifiableList(symbols);
		this.mainVariables = Collections.unmodifiableList(mainVariables);
		this.recursivePairs = Collections.unmodifiableList(recursivePairs);
		this.numeral = numeral;
	}

	public String getPattern() {
		return pattern;
	}

	public List<NotationSymbol> getSymbols() {
		return symbols;
	}

	/**
	 * @return the variables in the order they occur, a recursive list counting for its first variable
	 */
	public List<String> getMainVariables() {
		return mainVariables;
	}

	public List<RecursiveVariablePair> getRecursivePairs() {
		return recursivePairs;
	}

	/**
	 * @return every variable name of the pattern, including the closing variable of each recursive list
	 */
	public List<String> getAllVariables() {
		List<String> all = new ArrayList<>(mainVariables);
		for (RecursiveVariablePair pair : recursivePairs) {
			all.add(pair.getLast());
		}
		return all;
	}

	public boolean isNumeral() {
		return numeral;
	}

	public NotationKey getKey(NotationEntry entry) {
		return NotationKey.of(entry, symbols);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		DecomposedNotation that = (DecomposedNotation) o;
		return numeral == that.numeral && symbols.equals(that.symbols) && mainVariables.equals(that.mainVariables)
				&& recursivePairs.equals(that.recursivePairs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(symbols, mainVariables, recursivePairs, numeral);
	}
}
