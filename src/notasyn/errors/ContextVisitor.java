package notasyn.errors;

import notasyn.trans.WhileLoadingDeclaration;
import notasyn.trans.WhileRegisteringNotation;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileRegisteringNotation whileRegisteringNotation) throws E;
	public abstract T visit(WhileLoadingDeclaration whileLoadingDeclaration) throws E;

}
