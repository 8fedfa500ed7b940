package notasyn.trans;

import notasyn.errors.Issue;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a declaration is rejected. The state is back to what it was before the declaration.
 */
public class NotationRegistrationException extends NotaSynTransException {

	private static final long serialVersionUID = 4112871655046720823L;

	private final List<Issue> issues;

	public NotationRegistrationException(List<Issue> issues) {
		super(issues.stream().map(Issue::getMessage).collect(Collectors.joining("\n")));
		this.issues = Collections.unmodifiableList(issues);
	}

	public List<Issue> getIssues() {
		return issues;
	}

	/**
	 * @return the first issue, without its context
	 */
	public Issue getFirstIssue() {
		return issues.get(0).unwrap();
	}
}
