package notasyn.library;

import notasyn.model.notation.NotationEntry;
import notasyn.state.GrammarState;

import java.util.logging.Logger;

/**
 * Creates the grammar entry of a custom entry when opened.
 */
public class CustomEntryObject implements LibraryObject<CustomEntryObject.Declaration> {

	private static final Logger logger = Logger.getLogger("notasyn.library");

	public static final class Declaration {
		private final boolean local;
		private final String name;

		public Declaration(boolean local, String name) {
			this.local = local;
			this.name = name;
		}

		public boolean isLocal() {
			return local;
		}

		public String getName() {
			return name;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	private final GrammarState state;

	public CustomEntryObject(GrammarState state) {
		this.state = state;
	}

	@Override
	public String getName() {
		return "CUSTOM-ENTRY";
	}

	@Override
	public void declare(Declaration artifact) {
		// the entry only exists once opened
	}

	@Override
	public void cache(Declaration artifact) {
		open(1, artifact);
	}

	@Override
	public void open(int phase, Declaration artifact) {
		NotationEntry entry = NotationEntry.custom(artifact.getName());
		if (state.getGrammar().lookupEntry(entry.getGrammarName()) == null) {
			logger.fine("Creating custom entry " + artifact.getName());
			state.getGrammar().createEntry(entry);
		}
	}

	@Override
	public Declaration substitute(Substitution substitution, Declaration artifact) {
		return artifact;
	}

	@Override
	public Classification classify(Declaration artifact) {
		return artifact.isLocal() ? Classification.DISPOSE : Classification.KEEP;
	}
}
