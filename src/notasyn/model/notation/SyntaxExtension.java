package notasyn.model.notation;

import java.util.Objects;

/**
 * Everything registered for one notation key: how it parses, and possibly how it prints.
 */
public class SyntaxExtension {

	private final ParsingExtension parsing;
	private final PrintingExtension printing;

	public SyntaxExtension(ParsingExtension parsing, PrintingExtension printing) {
		this.parsing = parsing;
		this.printing = printing;
	}

	public NotationKey getKey() {
		return parsing.getKey();
	}

	public ParsingExtension getParsing() {
		return parsing;
	}

	/**
	 * @return the printing half, or null for parse-only notations
	 */
	public PrintingExtension getPrinting() {
		return printing;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SyntaxExtension that = (SyntaxExtension) o;
		return parsing.equals(that.parsing) && Objects.equals(printing, that.printing);
	}

	@Override
	public int hashCode() {
		return Objects.hash(parsing, printing);
	}
}
