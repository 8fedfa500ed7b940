package notasyn.model.notation;

import java.util.Objects;

/**
 * Marks a notation or an abbreviation as deprecated. Both parts are optional.
 */
public final class Deprecation {

	private final String since;
	private final String note;

	public Deprecation(String since, String note) {
		this.since = since;
		this.note = note;
	}

	/**
	 * @return the version the deprecation started with, or null
	 */
	public String getSince() {
		return since;
	}

	/**
	 * @return what to use instead, or null
	 */
	public String getNote() {
		return note;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Deprecation that = (Deprecation) o;
		return Objects.equals(since, that.since) && Objects.equals(note, that.note);
	}

	@Override
	public int hashCode() {
		return Objects.hash(since, note);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder("deprecated");
		if (since != null) {
			builder.append(" since ").append(since);
		}
		if (note != null) {
			builder.append(": ").append(note);
		}
		return builder.toString();
	}
}
