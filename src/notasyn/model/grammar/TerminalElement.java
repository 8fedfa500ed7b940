package notasyn.model.grammar;

import java.util.Objects;

public class TerminalElement extends ProductionElement {

	private final String text;
	private final boolean keyword;

	/**
	 * @param keyword whether the token is matched as a keyword rather than as an identifier
	 */
	public TerminalElement(String text, boolean keyword) {
		this.text = text;
		this.keyword = keyword;
	}

	public String getText() {
		return text;
	}

	public boolean isKeyword() {
		return keyword;
	}

	@Override
	public <T, E extends Throwable> T accept(ProductionElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text, keyword);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		TerminalElement other = (TerminalElement) obj;
		return keyword == other.keyword && text.equals(other.text);
	}
}
