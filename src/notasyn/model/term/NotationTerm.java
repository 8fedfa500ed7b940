package notasyn.model.term;

import java.util.Set;

/**
 * 
 * The interpretation of a notation: a term of the core calculus whose free notation variables
 * are filled in by the sub-terms the notation matched.
 *
 */
public abstract class NotationTerm {

	/**
	 * @param acc receives the names of the variables occurring in this term
	 */
	public abstract void collectVariables(Set<String> acc);

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public abstract String toString();

	public abstract <T, E extends Throwable> T accept(NotationTermVisitor<T, E> v) throws E;

}
