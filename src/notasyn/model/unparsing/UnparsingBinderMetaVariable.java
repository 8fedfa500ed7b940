package notasyn.model.unparsing;

import java.util.Objects;

/**
 * Prints the binder or pattern bound to a variable. Binders are printed quoted, as they would be
 * written in a binding position; names and patterns are printed as they are.
 */
public class UnparsingBinderMetaVariable extends UnparsingInstruction {

	private final String variable;
	private final boolean quoted;

	public UnparsingBinderMetaVariable(String variable, boolean quoted) {
		this.variable = variable;
		this.quoted = quoted;
	}

	public String getVariable() {
		return variable;
	}

	public boolean isQuoted() {
		return quoted;
	}

	@Override
	public <T, E extends Throwable> T accept(UnparsingInstructionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(variable, quoted);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		UnparsingBinderMetaVariable other = (UnparsingBinderMetaVariable) obj;
		return quoted == other.quoted && variable.equals(other.variable);
	}
}
