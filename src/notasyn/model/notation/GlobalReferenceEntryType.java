package notasyn.model.notation;

/**
 * A reference to a global definition.
 */
public class GlobalReferenceEntryType extends EntryType {

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
		return GlobalReferenceEntryType.class.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && getClass() == obj.getClass();
	}
}
