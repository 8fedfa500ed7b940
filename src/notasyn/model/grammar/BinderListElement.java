package notasyn.model.grammar;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A sequence of binders. Open binders are a single binder; closed binders repeat, separated by
 * the given terminals.
 */
public class BinderListElement extends ProductionElement {

	private final String variable;
	private final boolean open;
	private final List<TerminalElement> separator;

	public BinderListElement(String variable, boolean open, List<TerminalElement> separator) {
		this.variable = variable;
		this.open = open;
		this.separator = Collections.unmodifiableList(separator);
	}

	public String getVariable() {
		return variable;
	}

	public boolean isOpen() {
		return open;
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
		return Objects.hash(variable, open, separator);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		BinderListElement other = (BinderListElement) obj;
		return open == other.open && variable.equals(other.variable) && separator.equals(other.separator);
	}
}
