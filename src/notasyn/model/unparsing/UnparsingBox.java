package notasyn.model.unparsing;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A group of instructions sharing one line breaking decision. An hov box breaks only the cuts
 * that do not fit, an hv box breaks all of its cuts or none, a v box breaks all of them.
 */
public class UnparsingBox extends UnparsingInstruction {

	public enum Kind {
		HOV("hov"),
		HV("hv"),
		V("v");

		private final String name;

		Kind(String name) {
			this.name = name;
		}

		public String getName() {
			return name;
		}
	}

	private final Kind kind;
	private final int indent;
	private final List<UnparsingInstruction> children;

	public UnparsingBox(Kind kind, int indent, List<UnparsingInstruction> children) {
		this.kind = kind;
		this.indent = indent;
		this.children = Collections.unmodifiableList(children);
	}

	public Kind getKind() {
		return kind;
	}

	public int getIndent() {
		return indent;
	}

	public List<UnparsingInstruction> getChildren() {
		return children;
	}

	@Override
	public <T, E extends Throwable> T accept(UnparsingInstructionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, indent, children);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		UnparsingBox other = (UnparsingBox) obj;
		return kind == other.kind && indent == other.indent && children.equals(other.children);
	}
}
