package notasyn.model.unparsing;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * How a notation is displayed: its layout instructions and the printing directives of other
 * printers attached to it (the "extra" formats).
 */
public class PrintingRule {

	private final List<UnparsingInstruction> instructions;
	private final Map<String, String> extra;

	public PrintingRule(List<UnparsingInstruction> instructions, Map<String, String> extra) {
		this.instructions = Collections.unmodifiableList(instructions);
		this.extra = Collections.unmodifiableMap(extra);
	}

	public List<UnparsingInstruction> getInstructions() {
		return instructions;
	}

	public Map<String, String> getExtra() {
		return extra;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PrintingRule that = (PrintingRule) o;
		return instructions.equals(that.instructions) && extra.equals(that.extra);
	}

	@Override
	public int hashCode() {
		return Objects.hash(instructions, extra);
	}

	@Override
	public String toString() {
		String body = instructions.stream().map(UnparsingInstruction::toString).collect(Collectors.joining(" "));
		return extra.isEmpty() ? body : body + " " + extra;
	}
}
