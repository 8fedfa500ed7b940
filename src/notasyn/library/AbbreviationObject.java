package notasyn.library;

import notasyn.model.notation.Abbreviation;
import notasyn.state.GrammarState;

import java.util.logging.Logger;

/**
 * Records an abbreviation under its name.
 */
public class AbbreviationObject implements LibraryObject<Abbreviation> {

	private static final Logger logger = Logger.getLogger("notasyn.library");

	private final GrammarState state;

	public AbbreviationObject(GrammarState state) {
		this.state = state;
	}

	@Override
	public String getName() {
		return "ABBREVIATION";
	}

	@Override
	public void declare(Abbreviation artifact) {
		// the name is only bound once cached
	}

	@Override
	public void cache(Abbreviation artifact) {
		open(1, artifact);
	}

	@Override
	public void open(int phase, Abbreviation artifact) {
		if (!artifact.equals(state.getNotations().getAbbreviation(artifact.getName()))) {
			logger.fine("Abbreviating " + artifact);
			state.getNotations().declareAbbreviation(artifact);
		}
	}

	@Override
	public Abbreviation substitute(Substitution substitution, Abbreviation artifact) {
		if (substitution.isIdentity()) {
			return artifact;
		}
		return artifact.withBody(substitution.apply(artifact.getBody()));
	}

	@Override
	public Classification classify(Abbreviation artifact) {
		return artifact.isLocal() ? Classification.DISPOSE : Classification.KEEP;
	}
}
