package notasyn.model.term;

import java.util.Set;

public class TermVariable extends NotationTerm {

	private final String name;

	public TermVariable(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public void collectVariables(Set<String> acc) {
		acc.add(name);
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
		return name.equals(((TermVariable) obj).name);
	}

	@Override
	public String toString() {
		return name;
	}
}
