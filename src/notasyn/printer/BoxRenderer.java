package notasyn.printer;

import notasyn.model.unparsing.UnparsingBox;

import java.util.List;

/**
 * Renders layout nodes within a line width. Every box remembers the column it starts at; its
 * broken cuts go back to that column plus the box indent plus the cut indent.
 */
class BoxRenderer {

	private final int width;
	private final StringBuilder out;
	private int column;

	BoxRenderer(int width) {
		this.width = width;
		this.out = new StringBuilder();
		this.column = 0;
	}

	String render(List<LayoutNode> nodes) {
		renderBox(new LayoutBox(UnparsingBox.Kind.HOV, 0, nodes));
		return out.toString();
	}

	private void renderBox(LayoutBox box) {
		int base = column + box.getIndent();
		boolean breakAll;
		switch (box.getKind()) {
			case V:
				breakAll = true;
				break;
			case HV:
				breakAll = column + box.flatWidth() > width;
				break;
			default:
				breakAll = false;
				break;
		}

		List<LayoutNode> children = box.getChildren();
		for (int i = 0; i < children.size(); i++) {
			LayoutNode child = children.get(i);
			if (child instanceof LayoutText) {
				write(((LayoutText) child).getText());
			} else if (child instanceof LayoutBox) {
				renderBox((LayoutBox) child);
			} else {
				LayoutCut cut = (LayoutCut) child;
				boolean breakHere;
				if (cut.isForced()) {
					breakHere = true;
				} else if (box.getKind() == UnparsingBox.Kind.HOV) {
					breakHere = column + cut.getWidth() + segmentWidth(children, i + 1) > width;
				} else {
					breakHere = breakAll;
				}
				if (breakHere) {
					newLine(base + (cut.isForced() ? 0 : cut.getIndent()));
				} else {
					write(spaces(cut.getWidth()));
				}
			}
		}
	}

	/**
	 * The flat width of the nodes up to the next cut of the same box.
	 */
	private static int segmentWidth(List<LayoutNode> nodes, int from) {
		int total = 0;
		for (int i = from; i < nodes.size() && !(nodes.get(i) instanceof LayoutCut); i++) {
			total = Math.min(LayoutNode.UNBOUNDED, total + nodes.get(i).flatWidth());
		}
		return total;
	}

	private void write(String text) {
		out.append(text);
		column += text.length();
	}

	private void newLine(int indent) {
		// trailing blanks are dropped before breaking the line
		int end = out.length();
		while (end > 0 && out.charAt(end - 1) == ' ') {
			end--;
		}
		out.setLength(end);
		out.append('\n');
		out.append(spaces(indent));
		column = indent;
	}

	private static String spaces(int n) {
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < n; i++) {
			builder.append(' ');
		}
		return builder.toString();
	}
}
