package notasyn.model.notation;

import notasyn.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * A placeholder for a sub-term, named by an identifier of the pattern.
 *
 */
public class NotationVariable extends NotationSymbol {

	private final String name;

	public NotationVariable(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public boolean isNonTerminal() {
		return true;
	}

	@Override
	public <T, E extends Throwable> T accept(NotationSymbolVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		NotationVariable other = (NotationVariable) obj;
		return Objects.equals(name, other.name);
	}
}
