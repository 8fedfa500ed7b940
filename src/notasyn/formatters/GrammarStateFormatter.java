package notasyn.formatters;

import notasyn.model.grammar.GrammarRule;
import notasyn.model.grammar.Production;
import notasyn.model.notation.Abbreviation;
import notasyn.model.notation.NotationInterpretation;
import notasyn.model.notation.NotationKey;
import notasyn.model.notation.PrintingExtension;
import notasyn.printer.NotationPrinter;
import notasyn.state.GrammarState;
import notasyn.state.NotationRegistry;
import notasyn.state.ScopeTable;

import java.io.IOException;
import java.util.Map;

/**
 * Writes what is registered for each notation: its level, its grammar productions, its printing
 * rule with a sample rendering, and its interpretations. Scopes are written with their delimiting
 * key as {@code scope%key}.
 */
public class GrammarStateFormatter {

	private GrammarStateFormatter() {}

	public static void format(IndentingWriter out, GrammarState state, NotationPrinter printer) throws IOException {
		NotationRegistry notations = state.getNotations();
		out.write("Keywords:");
		for (String keyword : state.getTokens().getKeywords()) {
			out.write(" ");
			out.write(keyword);
		}
		out.newLine();
		ScopeTable scopes = state.getScopes();
		out.write("Scopes:");
		for (String scope : scopes.getScopes()) {
			out.write(" ");
			out.write(scope);
			String delimiter = scopes.getDelimiter(scope);
			if (delimiter != null) {
				out.write("%");
				out.write(delimiter);
			}
		}
		out.newLine();
		if (!scopes.getClassScopes().isEmpty()) {
			out.write("Classes:");
			for (Map.Entry<String, String> binding : scopes.getClassScopes().entrySet()) {
				out.write(" ");
				out.write(binding.getKey());
				out.write(" -> ");
				out.write(binding.getValue());
			}
			out.newLine();
		}

		for (NotationKey key : notations.getKeys()) {
			out.newLine();
			out.write("Notation ");
			out.write(key.toString());
			out.write(" at ");
			out.write(notations.getLevel(key).toString());
			try (IndentingWriter.Indent ignored = out.indent()) {
				GrammarRule rule = notations.getGrammarRule(key);
				if (rule != null) {
					out.newLine();
					out.write("grammar:");
					try (IndentingWriter.Indent ignored2 = out.indent()) {
						for (Production production : rule.getProductions()) {
							out.newLine();
							out.write("| ");
							out.write(production.toString());
						}
					}
				}
				PrintingExtension printing = notations.getPrintingRule(key);
				if (printing != null) {
					out.newLine();
					out.write("printing: ");
					out.write(printing.getRule().toString());
					out.newLine();
					out.write("renders as: ");
					try (IndentingWriter.Indent ignored2 = out.indentToPosition()) {
						out.write(printer.printRule(printing.getRule()));
					}
				}
				for (NotationInterpretation interpretation : notations.getInterpretations(key)) {
					out.newLine();
					out.write("interpretation");
					if (interpretation.getScope() != null) {
						out.write(" in ");
						out.write(interpretation.getScope());
					}
					out.write(": ");
					out.write(interpretation.getTerm().toString());
					out.write(" (");
					out.write(interpretation.getUse().name().toLowerCase().replace('_', ' '));
					out.write(")");
					if (interpretation.getDeprecation() != null) {
						out.write(", ");
						out.write(interpretation.getDeprecation().toString());
					}
				}
			}
		}
		for (Abbreviation abbreviation : notations.getAbbreviations()) {
			out.newLine();
			out.write("Abbreviation ");
			out.write(abbreviation.toString());
			if (abbreviation.isOnlyParsing()) {
				out.write(" (only parsing)");
			}
			if (abbreviation.getDeprecation() != null) {
				out.write(", ");
				out.write(abbreviation.getDeprecation().toString());
			}
		}
		out.newLine();
	}
}
