package notasyn.model.command;

import notasyn.model.notation.NotationDeclaration;

/**
 * A notation declaration. Without interpretation it reserves the syntax; with
 * {@code interpretationOnly} it adds an interpretation to a syntax declared earlier.
 */
public class NotationCommand extends Command {

	private final NotationDeclaration declaration;
	private final boolean interpretationOnly;

	public NotationCommand(NotationDeclaration declaration, boolean interpretationOnly) {
		this.declaration = declaration;
		this.interpretationOnly = interpretationOnly;
	}

	public NotationDeclaration getDeclaration() {
		return declaration;
	}

	public boolean isReserved() {
		return declaration.getInterpretation() == null;
	}

	public boolean isInterpretationOnly() {
		return interpretationOnly;
	}

	@Override
	public <T, E extends Throwable> T accept(CommandVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
