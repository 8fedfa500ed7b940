package notasyn.model.unparsing;

public class UnparsingLiteral extends UnparsingInstruction {

	private final String text;

	public UnparsingLiteral(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	/**
	 * @return whether the literal only prints blanks
	 */
	public boolean isBlank() {
		return text.trim().isEmpty();
	}

	@Override
	public <T, E extends Throwable> T accept(UnparsingInstructionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		return text.equals(((UnparsingLiteral) obj).text);
	}
}
