package notasyn.model.term;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A construct of the calculus that cannot be matched back against a term when printing, such
 * as a computation or a cast. It may still mention notation variables.
 */
public class TermOpaque extends NotationTerm {

	private final String description;
	private final List<NotationTerm> subterms;

	public TermOpaque(String description, List<NotationTerm> subterms) {
		this.description = description;
		this.subterms = Collections.unmodifiableList(subterms);
	}

	public String getDescription() {
		return description;
	}

	public List<NotationTerm> getSubterms() {
		return subterms;
	}

	@Override
	public void collectVariables(Set<String> acc) {
		for (NotationTerm subterm : subterms) {
			subterm.collectVariables(acc);
		}
	}

	@Override
	public <T, E extends Throwable> T accept(NotationTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(description, subterms);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		TermOpaque other = (TermOpaque) obj;
		return description.equals(other.description) && subterms.equals(other.subterms);
	}

	@Override
	public String toString() {
		return "<" + description + ">";
	}
}
