package notasyn.model.notation;

import java.util.Objects;

/**
 * The two ends x and y of a recursive pattern "x sep .. sep y". Both name the same repeated
 * sub-term and must be parsed the same way.
 */
public final class RecursiveVariablePair {

	private final String first;
	private final String last;

	public RecursiveVariablePair(String first, String last) {
		this.first = first;
		this.last = last;
	}

	public String getFirst() {
		return first;
	}

	public String getLast() {
		return last;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		RecursiveVariablePair that = (RecursiveVariablePair) o;
		return first.equals(that.first) && last.equals(that.last);
	}

	@Override
	public int hashCode() {
		return Objects.hash(first, last);
	}

	@Override
	public String toString() {
		return "(" + first + ", " + last + ")";
	}
}
