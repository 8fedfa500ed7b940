package notasyn.model.unparsing;

import notasyn.formatters.IndentingWriter;
import notasyn.formatters.UnparsingFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * 
 * One layout directive of a printing rule.
 *
 */
public abstract class UnparsingInstruction {

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new UnparsingFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new RuntimeException("You should never get an IO error from a StringWriter", e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(UnparsingInstructionVisitor<T, E> v) throws E;

}
