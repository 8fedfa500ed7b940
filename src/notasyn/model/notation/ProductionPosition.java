package notasyn.model.notation;

import java.util.Objects;

/**
 * Where a variable sits in its notation: on the left or right border (where it may borrow the
 * notation's own precedence, following the associativity), or strictly inside.
 */
public final class ProductionPosition {

	private static final ProductionPosition INTERNAL = new ProductionPosition(null, null);

	private final BorderSide side;
	private final Associativity associativity;

	private ProductionPosition(BorderSide side, Associativity associativity) {
		this.side = side;
		this.associativity = associativity;
	}

	public static ProductionPosition border(BorderSide side, Associativity associativity) {
		return new ProductionPosition(side, associativity);
	}

	public static ProductionPosition internal() {
		return INTERNAL;
	}

	public boolean isBorder() {
		return side != null;
	}

	public BorderSide getSide() {
		return side;
	}

	/**
	 * @return the associativity tag of a border position, null if the position is internal or
	 * the tag was dropped because the user fixed the level explicitly
	 */
	public Associativity getAssociativity() {
		return associativity;
	}

	public ProductionPosition withoutAssociativity() {
		return isBorder() ? border(side, null) : this;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ProductionPosition that = (ProductionPosition) o;
		return side == that.side && associativity == that.associativity;
	}

	@Override
	public int hashCode() {
		return Objects.hash(side, associativity);
	}

	@Override
	public String toString() {
		if (!isBorder()) {
			return "internal";
		}
		return side.name().toLowerCase() + " border" + (associativity == null ? "" : " (" + associativity.getDescription() + ")");
	}
}
