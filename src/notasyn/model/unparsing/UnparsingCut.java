package notasyn.model.unparsing;

import java.util.Objects;

/**
 * A potential line break. A breakable cut prints as {@code width} blanks when its box fits on
 * one line, and as a newline indented by {@code indent} otherwise.
 */
public class UnparsingCut extends UnparsingInstruction {

	public enum Kind {
		BREAK,
		FORCED_NEWLINE,
	}

	private final Kind kind;
	private final int width;
	private final int indent;

	private UnparsingCut(Kind kind, int width, int indent) {
		this.kind = kind;
		this.width = width;
		this.indent = indent;
	}

	public static UnparsingCut breakable(int width, int indent) {
		return new UnparsingCut(Kind.BREAK, width, indent);
	}

	public static UnparsingCut forcedNewline() {
		return new UnparsingCut(Kind.FORCED_NEWLINE, 0, 0);
	}

	public Kind getKind() {
		return kind;
	}

	public int getWidth() {
		return width;
	}

	public int getIndent() {
		return indent;
	}

	@Override
	public <T, E extends Throwable> T accept(UnparsingInstructionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, width, indent);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		UnparsingCut other = (UnparsingCut) obj;
		return kind == other.kind && width == other.width && indent == other.indent;
	}
}
