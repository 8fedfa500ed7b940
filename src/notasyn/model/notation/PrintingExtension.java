package notasyn.model.notation;

import notasyn.model.unparsing.PrintingRule;

import java.util.Objects;

public class PrintingExtension {

	private final boolean reserved;
	private final PrintingRule rule;

	/**
	 * @param reserved whether the rule comes from a reserved notation rather than from a notation
	 *                 with an interpretation
	 */
	public PrintingExtension(boolean reserved, PrintingRule rule) {
		this.reserved = reserved;
		this.rule = rule;
	}

	public boolean isReserved() {
		return reserved;
	}

	public PrintingRule getRule() {
		return rule;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PrintingExtension that = (PrintingExtension) o;
		return reserved == that.reserved && rule.equals(that.rule);
	}

	@Override
	public int hashCode() {
		return Objects.hash(reserved, rule);
	}
}
