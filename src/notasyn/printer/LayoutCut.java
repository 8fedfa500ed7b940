package notasyn.printer;

class LayoutCut extends LayoutNode {

	private final boolean forced;
	private final int width;
	private final int indent;

	LayoutCut(boolean forced, int width, int indent) {
		this.forced = forced;
		this.width = width;
		this.indent = indent;
	}

	boolean isForced() {
		return forced;
	}

	int getWidth() {
		return width;
	}

	int getIndent() {
		return indent;
	}

	@Override
	int flatWidth() {
		return forced ? UNBOUNDED : width;
	}
}
