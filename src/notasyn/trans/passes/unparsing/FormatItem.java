package notasyn.trans.passes.unparsing;

import notasyn.model.unparsing.UnparsingBox;
import notasyn.model.unparsing.UnparsingCut;
import notasyn.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * One item of a parsed format, before it is aligned with the notation symbols. Text items cover
 * literals, rigid blanks and variable references alike; which one a text item is depends on
 * what it is aligned with.
 */
public abstract class FormatItem {
	private final SourceLocation location;

	FormatItem(SourceLocation location) {
		this.location = location;
	}

	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * Structural equality, locations aside.
	 */
	public abstract boolean sameAs(FormatItem other);

	public static class Text extends FormatItem {
		private final String text;
		private final boolean quoted;

		public Text(SourceLocation location, String text, boolean quoted) {
			super(location);
			this.text = text;
			this.quoted = quoted;
		}

		public String getText() {
			return text;
		}

		public boolean isQuoted() {
			return quoted;
		}

		public boolean isBlank() {
			return !quoted && text.trim().isEmpty();
		}

		@Override
		public boolean sameAs(FormatItem other) {
			return other instanceof Text && text.equals(((Text) other).text) && quoted == ((Text) other).quoted;
		}

		@Override
		public String toString() {
			return quoted ? "'" + text + "'" : text;
		}
	}

	public static class Cut extends FormatItem {
		private final UnparsingCut cut;

		public Cut(SourceLocation location, UnparsingCut cut) {
			super(location);
			this.cut = cut;
		}

		public UnparsingCut getCut() {
			return cut;
		}

		@Override
		public boolean sameAs(FormatItem other) {
			return other instanceof Cut && cut.equals(((Cut) other).cut);
		}

		@Override
		public String toString() {
			return cut.toString();
		}
	}

	public static class Box extends FormatItem {
		private final UnparsingBox.Kind kind;
		private final int indent;
		private final List<FormatItem> children;

		public Box(SourceLocation location, UnparsingBox.Kind kind, int indent, List<FormatItem> children) {
			super(location);
			this.kind = kind;
			this.indent = indent;
			this.children = Collections.unmodifiableList(children);
		}

		public UnparsingBox.Kind getKind() {
			return kind;
		}

		public int getIndent() {
			return indent;
		}

		public List<FormatItem> getChildren() {
			return children;
		}

		@Override
		public boolean sameAs(FormatItem other) {
			if (!(other instanceof Box)) {
				return false;
			}
			Box box = (Box) other;
			if (kind != box.kind || indent != box.indent || children.size() != box.children.size()) {
				return false;
			}
			for (int i = 0; i < children.size(); i++) {
				if (!children.get(i).sameAs(box.children.get(i))) {
					return false;
				}
			}
			return true;
		}

		@Override
		public String toString() {
			return "[" + kind.getName() + " " + indent + " " + children + "]";
		}
	}

	public static class Ellipsis extends FormatItem {

		public Ellipsis(SourceLocation location) {
			super(location);
		}

		@Override
		public boolean sameAs(FormatItem other) {
			return other instanceof Ellipsis;
		}

		@Override
		public String toString() {
			return "..";
		}
	}
}
