package notasyn.model.grammar;

import java.util.Objects;

/**
 * Marks where the unrolled copies of a recursive list begin, so that the sub-terms they capture
 * can be folded back into one list. Consumes no input.
 */
public class ListMark extends ProductionElement {

	private final int count;
	private final boolean continued;
	private final int trailing;

	/**
	 * @param count the number of unrolled list elements that follow
	 * @param continued whether a list element follows the unrolled copies
	 * @param trailing how many of the captured elements belong after the list
	 */
	public ListMark(int count, boolean continued, int trailing) {
		this.count = count;
		this.continued = continued;
		this.trailing = trailing;
	}

	public int getCount() {
		return count;
	}

	public boolean isContinued() {
		return continued;
	}

	public int getTrailing() {
		return trailing;
	}

	@Override
	public <T, E extends Throwable> T accept(ProductionElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(count, continued, trailing);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		ListMark other = (ListMark) obj;
		return count == other.count && continued == other.continued && trailing == other.trailing;
	}
}
