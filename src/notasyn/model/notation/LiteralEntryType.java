package notasyn.model.notation;

/**
 * A big integer literal.
 */
public class LiteralEntryType extends EntryType {

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
		return LiteralEntryType.class.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && getClass() == obj.getClass();
	}
}
