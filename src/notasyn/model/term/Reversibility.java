package notasyn.model.term;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Whether an interpretation can be matched back against terms when printing.
 */
public final class Reversibility {

	public enum Kind {
		A_PRIORI_REVERSIBLE,
		HAS_OPAQUE,
		NON_INJECTIVE,
	}

	private static final Reversibility REVERSIBLE = new Reversibility(Kind.A_PRIORI_REVERSIBLE, Collections.emptyList());
	private static final Reversibility OPAQUE = new Reversibility(Kind.HAS_OPAQUE, Collections.emptyList());

	private final Kind kind;
	private final List<String> missingVariables;

	private Reversibility(Kind kind, List<String> missingVariables) {
		this.kind = kind;
		this.missingVariables = missingVariables;
	}

	public static Reversibility reversible() {
		return REVERSIBLE;
	}

	public static Reversibility hasOpaque() {
		return OPAQUE;
	}

	public static Reversibility nonInjective(List<String> missingVariables) {
		return new Reversibility(Kind.NON_INJECTIVE, Collections.unmodifiableList(missingVariables));
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the notation variables the interpretation does not mention
	 */
	public List<String> getMissingVariables() {
		return missingVariables;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Reversibility that = (Reversibility) o;
		return kind == that.kind && missingVariables.equals(that.missingVariables);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, missingVariables);
	}

	@Override
	public String toString() {
		return kind == Kind.NON_INJECTIVE ? kind + " " + missingVariables : kind.toString();
	}
}
