package notasyn.model.command;

import notasyn.model.notation.Deprecation;
import notasyn.model.notation.NotationModifiers;
import notasyn.model.term.NotationTerm;

public class InfixCommand extends Command {

	private final String operator;
	private final NotationModifiers modifiers;
	private final NotationTerm head;
	private final String scope;
	private final boolean local;
	private final Deprecation deprecation;

	public InfixCommand(String operator, NotationModifiers modifiers, NotationTerm head, String scope, boolean local,
						Deprecation deprecation) {
		this.operator = operator;
		this.modifiers = modifiers;
		this.head = head;
		this.scope = scope;
		this.local = local;
		this.deprecation = deprecation;
	}

	public String getOperator() {
		return operator;
	}

	public NotationModifiers getModifiers() {
		return modifiers;
	}

	public NotationTerm getHead() {
		return head;
	}

	public String getScope() {
		return scope;
	}

	public boolean isLocal() {
		return local;
	}

	public Deprecation getDeprecation() {
		return deprecation;
	}

	@Override
	public <T, E extends Throwable> T accept(CommandVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
