package notasyn.model.notation;

import notasyn.util.SourceLocation;

/**
 * 
 * Extra blanks between two tokens of a pattern. Ignored by parsing, kept as a
 * line-break hint for printing.
 *
 */
public class NotationBreak extends NotationSymbol {

	private final int width;

	public NotationBreak(SourceLocation location, int width) {
		super(location);
		this.width = width;
	}

	public int getWidth() {
		return width;
	}

	@Override
	public <T, E extends Throwable> T accept(NotationSymbolVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Integer.hashCode(width);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		return width == ((NotationBreak) obj).width;
	}
}
