package notasyn.model.notation;

import notasyn.model.term.NotationTerm;
import notasyn.model.unparsing.PrintingRule;

/**
 * What a notation means in one scope: the term it stands for, how it may be used, and the
 * printing rule specific to that scope if there is one.
 */
public class NotationInterpretation {

	private final NotationKey key;
	private final String pattern;
	private final String scope;
	private final NotationUse use;
	private final NotationTerm term;
	private final NotationCoercion coercion;
	private final PrintingRule specificRule;
	private final boolean local;
	private final Deprecation deprecation;

	public NotationInterpretation(NotationKey key, String pattern, String scope, NotationUse use, NotationTerm term,
								  NotationCoercion coercion, PrintingRule specificRule, boolean local) {
		this(key, pattern, scope, use, term, coercion, specificRule, local, null);
	}

	public NotationInterpretation(NotationKey key, String pattern, String scope, NotationUse use, NotationTerm term,
								  NotationCoercion coercion, PrintingRule specificRule, boolean local,
								  Deprecation deprecation) {
		this.key = key;
		this.pattern = pattern;
		this.scope = scope;
		this.use = use;
		this.term = term;
		this.coercion = coercion;
		this.specificRule = specificRule;
		this.local = local;
		this.deprecation = deprecation;
	}

	public NotationKey getKey() {
		return key;
	}

	public String getPattern() {
		return pattern;
	}

	/**
	 * @return the scope, or null for the default scope
	 */
	public String getScope() {
		return scope;
	}

	/**
	 * @return the use, or null when the interpretation is neither parsed nor printed
	 */
	public NotationUse getUse() {
		return use;
	}

	public NotationTerm getTerm() {
		return term;
	}

	public NotationCoercion getCoercion() {
		return coercion;
	}

	public PrintingRule getSpecificRule() {
		return specificRule;
	}

	public boolean isLocal() {
		return local;
	}

	public Deprecation getDeprecation() {
		return deprecation;
	}

	public NotationInterpretation withTerm(NotationTerm term) {
		return new NotationInterpretation(key, pattern, scope, use, term, coercion, specificRule, local, deprecation);
	}

	@Override
	public String toString() {
		return key + (scope == null ? "" : " in " + scope) + " := " + term;
	}
}
