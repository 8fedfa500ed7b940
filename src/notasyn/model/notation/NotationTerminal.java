package notasyn.model.notation;

import notasyn.util.SourceLocation;

import java.util.Objects;

/**
 * 
 * A literal token of a notation, e.g. the "+" of "x + y".
 *
 */
public class NotationTerminal extends NotationSymbol {

	private final String text;

	public NotationTerminal(SourceLocation location, String text) {
		super(location);
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(NotationSymbolVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		NotationTerminal other = (NotationTerminal) obj;
		return Objects.equals(text, other.text);
	}
}
