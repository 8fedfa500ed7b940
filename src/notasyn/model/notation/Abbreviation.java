package notasyn.model.notation;

import notasyn.model.term.NotationTerm;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A name standing for a term, applied to parameters: {@code double n := plus n n}. It has no
 * grammar rule of its own; the name is parsed as an identifier.
 */
public final class Abbreviation {

	private final String name;
	private final List<String> parameters;
	private final NotationTerm body;
	private final boolean onlyParsing;
	private final Deprecation deprecation;
	private final boolean local;

	public Abbreviation(String name, List<String> parameters, NotationTerm body, boolean onlyParsing,
						Deprecation deprecation, boolean local) {
		this.name = name;
		this.parameters = Collections.unmodifiableList(parameters);
		this.body = body;
		this.onlyParsing = onlyParsing;
		this.deprecation = deprecation;
		this.local = local;
	}

	public String getName() {
		return name;
	}

	public List<String> getParameters() {
		return parameters;
	}

	public NotationTerm getBody() {
		return body;
	}

	/**
	 * @return whether printing never folds terms back into the abbreviation
	 */
	public boolean isOnlyParsing() {
		return onlyParsing;
	}

	/**
	 * @return the deprecation, or null
	 */
	public Deprecation getDeprecation() {
		return deprecation;
	}

	public boolean isLocal() {
		return local;
	}

	public Abbreviation withBody(NotationTerm body) {
		return new Abbreviation(name, parameters, body, onlyParsing, deprecation, local);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Abbreviation that = (Abbreviation) o;
		return onlyParsing == that.onlyParsing && local == that.local && name.equals(that.name)
				&& parameters.equals(that.parameters) && body.equals(that.body)
				&& Objects.equals(deprecation, that.deprecation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, parameters, body, onlyParsing, deprecation, local);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder(name);
		for (String parameter : parameters) {
			builder.append(' ').append(parameter);
		}
		return builder.append(" := ").append(body).toString();
	}
}
