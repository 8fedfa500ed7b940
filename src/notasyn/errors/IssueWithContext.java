package notasyn.errors;

/**
 * An issue together with one level of the context it was reported in. Deeper levels are nested
 * inside {@link #getIssue()}.
 */
public class IssueWithContext extends Issue {

	private final Issue issue;
	private final Context context;

	public IssueWithContext(Issue issue, Context context) {
		this.issue = issue;
		this.context = context;
	}

	public Issue getIssue() {
		return issue;
	}

	public Context getContext() {
		return context;
	}

	@Override
	public Issue unwrap() {
		return issue.unwrap();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
