package notasyn.library;

import notasyn.model.term.NotationTerm;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A renaming of global references, applied to objects when the library they belong to is loaded
 * under another name.
 */
public class Substitution {

	private static final Substitution IDENTITY = new Substitution(Collections.emptyMap());

	private final Map<String, String> references;

	private Substitution(Map<String, String> references) {
		this.references = references;
	}

	public static Substitution identity() {
		return IDENTITY;
	}

	public static Substitution of(Map<String, String> references) {
		return new Substitution(Collections.unmodifiableMap(new HashMap<>(references)));
	}

	public boolean isIdentity() {
		return references.isEmpty();
	}

	public String apply(String reference) {
		return references.getOrDefault(reference, reference);
	}

	public NotationTerm apply(NotationTerm term) {
		if (isIdentity()) {
			return term;
		}
		return term.accept(new SubstitutionVisitor(this));
	}
}
