package notasyn.model.grammar;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public class Production {

	private final List<ProductionElement> elements;

	public Production(List<ProductionElement> elements) {
		this.elements = Collections.unmodifiableList(elements);
	}

	public List<ProductionElement> getElements() {
		return elements;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return elements.equals(((Production) o).elements);
	}

	@Override
	public int hashCode() {
		return elements.hashCode();
	}

	@Override
	public String toString() {
		return elements.stream().map(ProductionElement::toString).collect(Collectors.joining(" "));
	}
}
