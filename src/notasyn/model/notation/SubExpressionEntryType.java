package notasyn.model.notation;

import java.util.Objects;

public class SubExpressionEntryType extends EntryType {

	private final NotationEntry entry;
	private final ProductionLevel level;
	private final ProductionPosition position;

	public SubExpressionEntryType(NotationEntry entry, ProductionLevel level, ProductionPosition position) {
		this.entry = entry;
		this.level = level;
		this.position = position;
	}

	public NotationEntry getEntry() {
		return entry;
	}

	public ProductionLevel getLevel() {
		return level;
	}

	public ProductionPosition getPosition() {
		return position;
	}

	@Override
	public <T, E extends Throwable> T accept(EntryTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(entry, level, position);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		SubExpressionEntryType other = (SubExpressionEntryType) obj;
		return Objects.equals(entry, other.entry) && Objects.equals(level, other.level)
				&& Objects.equals(position, other.position);
	}
}
