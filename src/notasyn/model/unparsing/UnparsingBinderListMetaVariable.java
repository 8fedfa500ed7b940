package notasyn.model.unparsing;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class UnparsingBinderListMetaVariable extends UnparsingInstruction {

	private final String variable;
	private final boolean open;
	private final List<UnparsingInstruction> separator;

	public UnparsingBinderListMetaVariable(String variable, boolean open, List<UnparsingInstruction> separator) {
		this.variable = variable;
		this.open = open;
		this.separator = Collections.unmodifiableList(separator);
	}

	public String getVariable() {
		return variable;
	}

	public boolean isOpen() {
		return open;
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
		return Objects.hash(variable, open, separator);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		UnparsingBinderListMetaVariable other = (UnparsingBinderListMetaVariable) obj;
		return open == other.open && variable.equals(other.variable) && separator.equals(other.separator);
	}
}
