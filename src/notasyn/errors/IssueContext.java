package notasyn.errors;

/**
 * Where passes report their issues. Errors stop the current registration; warnings are kept
 * alongside a successful one.
 */
public abstract class IssueContext {

	public abstract void error(Issue err);

	public abstract void warning(Issue warning);

	public abstract boolean hasErrors();

	/**
	 * @return a context that wraps every issue reported through it in {@code context}
	 */
	public IssueContext withContext(Context context) {
		return new NestedIssueContext(this, context);
	}
}
