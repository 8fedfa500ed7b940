package notasyn.model.grammar;

import notasyn.formatters.IndentingWriter;
import notasyn.formatters.ProductionElementFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * One element of a synthesized grammar production.
 */
public abstract class ProductionElement {

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new ProductionElementFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new RuntimeException("You should never get an IO error from a StringWriter", e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(ProductionElementVisitor<T, E> v) throws E;

}
