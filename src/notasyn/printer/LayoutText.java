package notasyn.printer;

class LayoutText extends LayoutNode {

	private final String text;

	LayoutText(String text) {
		this.text = text;
	}

	String getText() {
		return text;
	}

	@Override
	int flatWidth() {
		return text.length();
	}
}
