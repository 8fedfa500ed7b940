package notasyn.library;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * The log of the objects declared so far. Every object goes through its callbacks once, in
 * declaration order; the ones classified {@link Classification#KEEP} stay in the log.
 */
public class Library {

	private static final Logger logger = Logger.getLogger("notasyn.library");

	public static final class Leaf<A> {
		private final LibraryObject<A> object;
		private final A artifact;

		private Leaf(LibraryObject<A> object, A artifact) {
			this.object = object;
			this.artifact = artifact;
		}

		public LibraryObject<A> getObject() {
			return object;
		}

		public A getArtifact() {
			return artifact;
		}

		@Override
		public String toString() {
			return object.getName() + " " + artifact;
		}
	}

	private final List<Leaf<?>> leaves;

	public Library() {
		this.leaves = new ArrayList<>();
	}

	private Library(List<Leaf<?>> leaves) {
		this.leaves = new ArrayList<>(leaves);
	}

	/**
	 * Declares, caches and opens the artifact, then substitutes it by the identity and classifies it.
	 *
	 * @return whether the artifact was kept in the log
	 */
	public <A> boolean addLeaf(LibraryObject<A> object, A artifact) {
		logger.fine("Adding " + object.getName() + " object");
		object.declare(artifact);
		object.cache(artifact);
		object.open(1, artifact);
		A substituted = object.substitute(Substitution.identity(), artifact);
		if (object.classify(substituted) == Classification.KEEP) {
			leaves.add(new Leaf<>(object, substituted));
			return true;
		}
		return false;
	}

	public List<Leaf<?>> getLeaves() {
		return Collections.unmodifiableList(leaves);
	}

	public Library copy() {
		return new Library(leaves);
	}
}
