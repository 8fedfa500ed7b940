package notasyn.library;

/**
 * One kind of object a library records, with the callbacks the library runs on it. The artifact
 * is the data of one object of that kind.
 *
 * @param <A> the type of the artifacts
 */
public interface LibraryObject<A> {

	String getName();

	/**
	 * Makes the names the artifact introduces known, without activating anything.
	 */
	void declare(A artifact);

	/**
	 * Installs the artifact in the current state.
	 */
	void cache(A artifact);

	/**
	 * Activates the artifact when the library holding it is opened; phase 1 is the immediate one.
	 */
	void open(int phase, A artifact);

	A substitute(Substitution substitution, A artifact);

	Classification classify(A artifact);

}
