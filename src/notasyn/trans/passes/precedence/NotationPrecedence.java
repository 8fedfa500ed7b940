package notasyn.trans.passes.precedence;

import notasyn.model.notation.Associativity;

/**
 * The level and associativity a notation is declared at, once defaults have been applied.
 */
public class NotationPrecedence {
	private final int level;
	private final Associativity associativity;

	public NotationPrecedence(int level, Associativity associativity) {
		this.level = level;
		this.associativity = associativity;
	}

	public int getLevel() {
		return level;
	}

	public Associativity getAssociativity() {
		return associativity;
	}
}
