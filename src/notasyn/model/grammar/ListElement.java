package notasyn.model.grammar;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One or more sub-expressions of the same entry, separated by a fixed sequence of terminals.
 */
public class ListElement extends ProductionElement {

	private final String variable;
	private final ProductionEntry entry;
	private final List<TerminalElement> separator;

	public ListElement(String variable, ProductionEntry entry, List<TerminalElement> separator) {
		this.variable = variable;
		this.entry = entry;
		this.separator = Collections.unmodifiableList(separator);
	}

	public String getVariable() {
		return variable;
	}

	public ProductionEntry getEntry() {
		return entry;
	}

	public List<TerminalElement> getSeparator() {
		return separator;
	}

	@Override
	public <T, E extends Throwable> T accept(ProductionElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(variable, entry, separator);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		ListElement other = (ListElement) obj;
		return variable.equals(other.variable) && entry.equals(other.entry) && separator.equals(other.separator);
	}
}
