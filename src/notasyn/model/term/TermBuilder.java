package notasyn.model.term;

import java.util.Arrays;
import java.util.Collections;

public class TermBuilder {

	private TermBuilder() {}

	public static TermVariable var(String name) {
		return new TermVariable(name);
	}

	public static TermReference ref(String name) {
		return new TermReference(name);
	}

	public static TermApplication app(String head, NotationTerm... arguments) {
		return new TermApplication(ref(head), Arrays.asList(arguments));
	}

	public static TermApplication app(NotationTerm head, NotationTerm... arguments) {
		return new TermApplication(head, Arrays.asList(arguments));
	}

	public static TermHole hole() {
		return new TermHole();
	}

	public static TermOpaque opaque(String description, NotationTerm... subterms) {
		return new TermOpaque(description, subterms.length == 0 ? Collections.emptyList() : Arrays.asList(subterms));
	}
}
