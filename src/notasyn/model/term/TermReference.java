package notasyn.model.term;

import java.util.Set;

/**
 * A reference to a global definition.
 */
public class TermReference extends NotationTerm {

	private final String name;

	public TermReference(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public void collectVariables(Set<String> acc) {
		// no variables
	}

	@Override
	public <T, E extends Throwable> T accept(NotationTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		return name.equals(((TermReference) obj).name);
	}

	@Override
	public String toString() {
		return "@" + name;
	}
}
