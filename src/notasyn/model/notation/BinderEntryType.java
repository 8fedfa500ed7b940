package notasyn.model.notation;

import java.util.Objects;

/**
 * A binder. An open binder is a single name possibly with a type annotation; a closed binder
 * is a parenthesised binder group, which is what recursive binder lists may be separated by.
 */
public class BinderEntryType extends EntryType {

	private final boolean open;

	public BinderEntryType(boolean open) {
		this.open = open;
	}

	public boolean isOpen() {
		return open;
	}

	@Override
	public <T, E extends Throwable> T accept(EntryTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(open);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		return open == ((BinderEntryType) obj).open;
	}
}
