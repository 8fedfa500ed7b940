package notasyn.printer;

public class PrintLeaf extends PrintTree {

	private final String text;
	private final int level;

	public PrintLeaf(String text, int level) {
		this.text = text;
		this.level = level;
	}

	public String getText() {
		return text;
	}

	@Override
	public int getLevel() {
		return level;
	}
}
