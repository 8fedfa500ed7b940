package notasyn.library;

import notasyn.errors.IssueContext;
import notasyn.model.notation.NotationInterpretation;
import notasyn.state.GrammarState;
import notasyn.state.NotationRegistry;
import notasyn.trans.passes.compat.CompatibilityCheckPass;

/**
 * Records the interpretation of a notation in its scope, along with the printing rule specific
 * to that scope.
 */
public class NotationObject implements LibraryObject<NotationInterpretation> {

	private final GrammarState state;
	private final IssueContext ctx;

	public NotationObject(GrammarState state, IssueContext ctx) {
		this.state = state;
		this.ctx = ctx;
	}

	@Override
	public String getName() {
		return "NOTATION";
	}

	@Override
	public void declare(NotationInterpretation artifact) {
		if (artifact.getScope() != null) {
			CompatibilityCheckPass.ensureScope(ctx, state.getScopes(), artifact.getScope());
		}
	}

	@Override
	public void cache(NotationInterpretation artifact) {
		install(artifact);
	}

	@Override
	public void open(int phase, NotationInterpretation artifact) {
		if (phase == 1) {
			install(artifact);
		}
	}

	private void install(NotationInterpretation artifact) {
		NotationRegistry notations = state.getNotations();
		if (notations.getInterpretations().contains(artifact)) {
			return;
		}
		if (artifact.getSpecificRule() != null && CompatibilityCheckPass.checkSpecificPrinting(
				ctx, notations, artifact.getScope(), artifact.getKey(), artifact.getSpecificRule())) {
			notations.declareSpecificPrintingRule(artifact.getScope(), artifact.getKey(), artifact.getSpecificRule());
		}
		notations.addInterpretation(artifact);
	}

	@Override
	public NotationInterpretation substitute(Substitution substitution, NotationInterpretation artifact) {
		if (substitution.isIdentity()) {
			return artifact;
		}
		return artifact.withTerm(substitution.apply(artifact.getTerm()));
	}

	@Override
	public Classification classify(NotationInterpretation artifact) {
		return artifact.isLocal() ? Classification.DISPOSE : Classification.KEEP;
	}
}
