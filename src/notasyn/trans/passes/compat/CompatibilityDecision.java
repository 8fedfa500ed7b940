package notasyn.trans.passes.compat;

/**
 * Which parts of a syntax extension still have to be installed.
 */
public class CompatibilityDecision {

	private final boolean declareLevel;
	private final boolean installGrammar;
	private final boolean installPrinting;

	public CompatibilityDecision(boolean declareLevel, boolean installGrammar, boolean installPrinting) {
		this.declareLevel = declareLevel;
		this.installGrammar = installGrammar;
		this.installPrinting = installPrinting;
	}

	public boolean isDeclareLevel() {
		return declareLevel;
	}

	public boolean isInstallGrammar() {
		return installGrammar;
	}

	public boolean isInstallPrinting() {
		return installPrinting;
	}

	public boolean isNoOp() {
		return !declareLevel && !installGrammar && !installPrinting;
	}
}
