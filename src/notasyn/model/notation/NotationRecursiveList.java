package notasyn.model.notation;

import notasyn.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * 
 * The folded form of "x sep .. sep y": a repetition of the variable x separated
 * by the separator symbols.
 *
 */
public class NotationRecursiveList extends NotationSymbol {

	private final String variable;
	private final List<NotationSymbol> separator;

	public NotationRecursiveList(SourceLocation location, String variable, List<NotationSymbol> separator) {
		super(location);
		this.variable = variable;
		this.separator = separator;
	}

	public String getVariable() {
		return variable;
	}

	public List<NotationSymbol> getSeparator() {
		return separator;
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
		return Objects.hash(variable, separator);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		NotationRecursiveList other = (NotationRecursiveList) obj;
		return Objects.equals(variable, other.variable) && Objects.equals(separator, other.separator);
	}
}
