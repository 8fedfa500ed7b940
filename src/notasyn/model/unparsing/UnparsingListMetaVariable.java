package notasyn.model.unparsing;

import notasyn.model.notation.PrecedenceConstraint;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Prints the elements of a recursive list, each under the constraint, with the separator
 * instructions between consecutive elements.
 */
public class UnparsingListMetaVariable extends UnparsingInstruction {

	private final String variable;
	private final PrecedenceConstraint constraint;
	private final List<UnparsingInstruction> separator;

	public UnparsingListMetaVariable(String variable, PrecedenceConstraint constraint,
									 List<UnparsingInstruction> separator) {
		this.variable = variable;
		this.constraint = constraint;
		this.separator = Collections.unmodifiableList(separator);
	}

	public String getVariable() {
		return variable;
	}

	public PrecedenceConstraint getConstraint() {
		return constraint;
	}

	public List<UnparsingInstruction> getSeparator() {
		return separator;
	}

	@Override
	public <T, E extends Throwable> T accept(UnparsingInstructionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(variable, constraint, separator);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		UnparsingListMetaVariable other = (UnparsingListMetaVariable) obj;
		return variable.equals(other.variable) && constraint.equals(other.constraint)
				&& separator.equals(other.separator);
	}
}
