package notasyn.errors;

import notasyn.Unreachable;
import notasyn.formatters.IndentingWriter;
import notasyn.formatters.IssueFormattingVisitor;
import notasyn.trans.NotaSynTransException;

import java.io.IOException;
import java.io.StringWriter;

/**
 * A problem found while registering notations. Its message is rendered by
 * {@link IssueFormattingVisitor}, so subclasses only carry data.
 */
public abstract class Issue extends NotaSynTransException {

	public Issue() {
		super("");
	}

	public Issue(String msg) {
		super(msg);
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		try {
			accept(new IssueFormattingVisitor(new IndentingWriter(sw)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return sw.toString();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	/**
	 * @return the issue this one wraps, without its contexts
	 */
	public Issue unwrap() {
		return this;
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;
}
