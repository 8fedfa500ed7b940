package notasyn.trans.passes.printability;

import notasyn.model.notation.NotationCoercion;

/**
 * Whether an interpretation is disabled for printing, and the coercion it declares if any.
 */
public final class Printability {

	private final boolean onlyParsing;
	private final NotationCoercion coercion;

	public Printability(boolean onlyParsing, NotationCoercion coercion) {
		this.onlyParsing = onlyParsing;
		this.coercion = coercion;
	}

	public boolean isOnlyParsing() {
		return onlyParsing;
	}

	/**
	 * @return the coercion, or null
	 */
	public NotationCoercion getCoercion() {
		return coercion;
	}
}
