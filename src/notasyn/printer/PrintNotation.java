package notasyn.printer;

import notasyn.model.unparsing.PrintingRule;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public class PrintNotation extends PrintTree {

	private final PrintingRule rule;
	private final int level;
	private final Map<String, List<PrintTree>> arguments;

	public PrintNotation(PrintingRule rule, int level, Map<String, List<PrintTree>> arguments) {
		this.rule = rule;
		this.level = level;
		this.arguments = Collections.unmodifiableMap(arguments);
	}

	public PrintingRule getRule() {
		return rule;
	}

	@Override
	public int getLevel() {
		return level;
	}

	public Map<String, List<PrintTree>> getArguments() {
		return arguments;
	}
}
