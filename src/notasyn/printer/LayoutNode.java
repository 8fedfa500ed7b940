package notasyn.printer;

abstract class LayoutNode {

	static final int UNBOUNDED = Integer.MAX_VALUE / 2;

	/**
	 * @return the width of the node printed on one line, or {@link #UNBOUNDED} when it contains a forced newline
	 */
	abstract int flatWidth();
}
