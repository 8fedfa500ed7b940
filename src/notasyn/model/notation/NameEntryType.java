package notasyn.model.notation;

/**
 * A name: an identifier or the anonymous `_`.
 */
public class NameEntryType extends EntryType {

	@Override
	public boolean isAtomic() {
		return true;
	}

	@Override
	public <T, E extends Throwable> T accept(EntryTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return NameEntryType.class.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && getClass() == obj.getClass();
	}
}
