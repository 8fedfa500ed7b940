package notasyn.model.term;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

public class TermApplication extends NotationTerm {

	private final NotationTerm head;
	private final List<NotationTerm> arguments;

	public TermApplication(NotationTerm head, List<NotationTerm> arguments) {
		this.head = head;
		this.arguments = Collections.unmodifiableList(arguments);
	}

	public NotationTerm getHead() {
		return head;
	}

	public List<NotationTerm> getArguments() {
		return arguments;
	}

	@Override
	public void collectVariables(Set<String> acc) {
		head.collectVariables(acc);
		for (NotationTerm argument : arguments) {
			argument.collectVariables(acc);
		}
	}

	@Override
	public <T, E extends Throwable> T accept(NotationTermVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(head, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		TermApplication other = (TermApplication) obj;
		return head.equals(other.head) && arguments.equals(other.arguments);
	}

	@Override
	public String toString() {
		return "(" + head + " " + arguments.stream().map(NotationTerm::toString).collect(Collectors.joining(" ")) + ")";
	}
}
