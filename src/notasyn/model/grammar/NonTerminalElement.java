package notasyn.model.grammar;

import java.util.Objects;

public class NonTerminalElement extends ProductionElement {

	private final String variable;
	private final ProductionEntry entry;

	public NonTerminalElement(String variable, ProductionEntry entry) {
		this.variable = variable;
		this.entry = entry;
	}

	public String getVariable() {
		return variable;
	}

	public ProductionEntry getEntry() {
		return entry;
	}

	@Override
	public <T, E extends Throwable> T accept(ProductionElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(variable, entry);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		NonTerminalElement other = (NonTerminalElement) obj;
		return variable.equals(other.variable) && entry.equals(other.entry);
	}
}
