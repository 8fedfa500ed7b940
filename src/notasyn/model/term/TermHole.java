package notasyn.model.term;

import java.util.Set;

/**
 * A placeholder left for the elaborator to fill in.
 */
public class TermHole extends NotationTerm {

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
		return TermHole.class.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && getClass() == obj.getClass();
	}

	@Override
	public String toString() {
		return "_";
	}
}
