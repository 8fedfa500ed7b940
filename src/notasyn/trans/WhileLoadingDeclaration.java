package notasyn.trans;

import notasyn.errors.Context;
import notasyn.errors.ContextVisitor;

public class WhileLoadingDeclaration extends Context {

	private final String file;
	private final int index;

	/**
	 * @param index the position of the declaration in its list, from 0
	 */
	public WhileLoadingDeclaration(String file, int index) {
		this.file = file;
		this.index = index;
	}

	public String getFile() {
		return file;
	}

	public int getIndex() {
		return index;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}
}
