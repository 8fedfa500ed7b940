package notasyn.model.unparsing;

import notasyn.model.notation.PrecedenceConstraint;

import java.util.Objects;

/**
 * Prints the sub-term bound to a variable, parenthesised when its level violates the constraint.
 */
public class UnparsingMetaVariable extends UnparsingInstruction {

	private final String variable;
	private final PrecedenceConstraint constraint;

	public UnparsingMetaVariable(String variable, PrecedenceConstraint constraint) {
		this.variable = variable;
		this.constraint = constraint;
	}

	public String getVariable() {
		return variable;
	}

	public PrecedenceConstraint getConstraint() {
		return constraint;
	}

	@Override
	public <T, E extends Throwable> T accept(UnparsingInstructionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(variable, constraint);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		UnparsingMetaVariable other = (UnparsingMetaVariable) obj;
		return variable.equals(other.variable) && constraint.equals(other.constraint);
	}
}
