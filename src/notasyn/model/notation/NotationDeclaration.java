package notasyn.model.notation;

import notasyn.model.term.NotationTerm;

/**
 * A user declaration: a pattern with its modifiers, an optional interpretation, and the
 * scope it is declared in.
 */
public class NotationDeclaration {

	private final String pattern;
	private final NotationModifiers modifiers;
	private final NotationTerm interpretation;
	private final String scope;
	private final boolean local;
	private final Deprecation deprecation;

	public NotationDeclaration(String pattern, NotationModifiers modifiers, NotationTerm interpretation,
							   String scope, boolean local) {
		this(pattern, modifiers, interpretation, scope, local, null);
	}

	public NotationDeclaration(String pattern, NotationModifiers modifiers, NotationTerm interpretation,
							   String scope, boolean local, Deprecation deprecation) {
		this.pattern = pattern;
		this.modifiers = modifiers;
		this.interpretation = interpretation;
		this.scope = scope;
		this.local = local;
		this.deprecation = deprecation;
	}

	public static NotationDeclaration reserved(String pattern, NotationModifiers modifiers) {
		return new NotationDeclaration(pattern, modifiers, null, null, false);
	}

	public String getPattern() {
		return pattern;
	}

	public NotationModifiers getModifiers() {
		return modifiers;
	}

	/**
	 * @return the term the notation stands for, or null for a reserved notation
	 */
	public NotationTerm getInterpretation() {
		return interpretation;
	}

	public String getScope() {
		return scope;
	}

	public boolean isLocal() {
		return local;
	}

	/**
	 * @return the deprecation, or null
	 */
	public Deprecation getDeprecation() {
		return deprecation;
	}
}
