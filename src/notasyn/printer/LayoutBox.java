package notasyn.printer;

import notasyn.model.unparsing.UnparsingBox;

import java.util.List;

class LayoutBox extends LayoutNode {

	private final UnparsingBox.Kind kind;
	private final int indent;
	private final List<LayoutNode> children;

	LayoutBox(UnparsingBox.Kind kind, int indent, List<LayoutNode> children) {
		this.kind = kind;
		this.indent = indent;
		this.children = children;
	}

	UnparsingBox.Kind getKind() {
		return kind;
	}

	int getIndent() {
		return indent;
	}

	List<LayoutNode> getChildren() {
		return children;
	}

	@Override
	int flatWidth() {
		int total = 0;
		for (LayoutNode child : children) {
			total = Math.min(UNBOUNDED, total + child.flatWidth());
		}
		return total;
	}
}
