package notasyn.trans;

import notasyn.errors.Context;
import notasyn.errors.ContextVisitor;

public class WhileRegisteringNotation extends Context {

	private final String pattern;

	public WhileRegisteringNotation(String pattern) {
		this.pattern = pattern;
	}

	public String getPattern() {
		return pattern;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}
}
