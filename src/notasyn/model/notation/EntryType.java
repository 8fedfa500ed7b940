package notasyn.model.notation;

import notasyn.formatters.EntryTypeFormattingVisitor;
import notasyn.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;

/**
 * 
 * How a notation variable is parsed: as a sub-expression of some entry, or as one of
 * the special categories (identifiers, names, binders, patterns, references, literals).
 *
 */
public abstract class EntryType {

	/**
	 * @return true for the categories that always parse a single token, and may
	 * therefore start a notation at level 0
	 */
	public boolean isAtomic() {
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
			accept(new EntryTypeFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new RuntimeException("You should never get an IO error from a StringWriter", e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(EntryTypeVisitor<T, E> v) throws E;

}
