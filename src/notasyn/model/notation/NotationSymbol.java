package notasyn.model.notation;

import notasyn.formatters.IndentingWriter;
import notasyn.formatters.NotationSymbolFormattingVisitor;
import notasyn.util.SourceLocatable;
import notasyn.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * 
 * One token of a decomposed notation pattern. Knows the span of the pattern it
 * was read from, but that span does not take part in equality.
 *
 */
public abstract class NotationSymbol extends SourceLocatable {
	private final SourceLocation location;

	public NotationSymbol(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return true for the symbols that stand for a sub-term: variables and recursive lists
	 */
	public boolean isNonTerminal() {
		return false;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new NotationSymbolFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new RuntimeException("You should never get an IO error from a StringWriter", e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(NotationSymbolVisitor<T, E> v) throws E;

}
