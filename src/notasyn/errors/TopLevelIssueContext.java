package notasyn.errors;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import notasyn.Unreachable;
import notasyn.formatters.IndentingWriter;
import notasyn.formatters.IssueFormattingVisitor;

/**
 * Collects the issues of one run or one registration. Warnings are also logged as they come.
 */
public class TopLevelIssueContext extends IssueContext {

	private static final Logger logger = Logger.getLogger("notasyn.errors");

	private final List<Issue> errors = new ArrayList<>();
	private final List<Issue> warnings = new ArrayList<>();

	@Override
	public void error(Issue err) {
		errors.add(err);
	}

	@Override
	public void warning(Issue warning) {
		logger.warning(warning.getMessage());
		warnings.add(warning);
	}

	@Override
	public boolean hasErrors() {
		return !errors.isEmpty();
	}

	public List<Issue> getIssues() {
		return Collections.unmodifiableList(errors);
	}

	public List<Issue> getWarnings() {
		return Collections.unmodifiableList(warnings);
	}

	public void clear() {
		errors.clear();
		warnings.clear();
	}

	/**
	 * Writes a count of the errors, then each error on its own line.
	 */
	public void format(IndentingWriter out) throws IOException {
		out.write("Detected " + errors.size() + " issue(s):");
		IssueFormattingVisitor formatter = new IssueFormattingVisitor(out);
		for (Issue err : errors) {
			out.newLine();
			err.accept(formatter);
		}
	}

	public String format() {
		StringWriter sw = new StringWriter();
		try {
			format(new IndentingWriter(sw));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return sw.toString();
	}
}
