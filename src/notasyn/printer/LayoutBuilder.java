package notasyn.printer;

import notasyn.model.notation.PrecedenceConstraint;
import notasyn.model.unparsing.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Turns the instructions of a printing rule into layout nodes, printing the sub-terms bound to the
 * variables in place of the metavariables. Without arguments, each metavariable prints its name and
 * each list prints its first element followed by an ellipsis.
 */
class LayoutBuilder extends UnparsingInstructionVisitor<List<LayoutNode>, RuntimeException> {

	private final Map<String, List<PrintTree>> arguments;

	LayoutBuilder(Map<String, List<PrintTree>> arguments) {
		this.arguments = arguments;
	}

	static List<LayoutNode> layoutTree(PrintTree tree, PrecedenceConstraint constraint) {
		List<LayoutNode> nodes;
		if (tree instanceof PrintLeaf) {
			nodes = Collections.singletonList(new LayoutText(((PrintLeaf) tree).getText()));
		} else {
			PrintNotation notation = (PrintNotation) tree;
			LayoutBuilder builder = new LayoutBuilder(notation.getArguments());
			nodes = Collections.singletonList(new LayoutBox(UnparsingBox.Kind.HOV, 0,
					builder.layoutAll(notation.getRule().getInstructions())));
		}
		if (constraint.accepts(tree.getLevel())) {
			return nodes;
		}
		List<LayoutNode> parenthesized = new ArrayList<>();
		parenthesized.add(new LayoutText("("));
		parenthesized.addAll(nodes);
		parenthesized.add(new LayoutText(")"));
		return parenthesized;
	}

	List<LayoutNode> layoutAll(List<UnparsingInstruction> instructions) {
		List<LayoutNode> nodes = new ArrayList<>();
		for (UnparsingInstruction instruction : instructions) {
			nodes.addAll(instruction.accept(this));
		}
		return nodes;
	}

	private List<PrintTree> argument(String variable) {
		List<PrintTree> trees = arguments.get(variable);
		if (trees == null) {
			throw new IllegalArgumentException("no sub-term bound to " + variable);
		}
		return trees;
	}

	private List<LayoutNode> single(String variable, PrecedenceConstraint constraint) {
		if (arguments == null) {
			return Collections.singletonList(new LayoutText(variable));
		}
		List<PrintTree> trees = argument(variable);
		if (trees.size() != 1) {
			throw new IllegalArgumentException(variable + " is bound to " + trees.size() + " sub-terms");
		}
		return layoutTree(trees.get(0), constraint);
	}

	private List<LayoutNode> list(String variable, PrecedenceConstraint constraint, List<UnparsingInstruction> separator) {
		List<LayoutNode> separatorNodes = separator.isEmpty()
				? Collections.singletonList(new LayoutCut(false, 1, 0)) : layoutAll(separator);
		List<LayoutNode> nodes = new ArrayList<>();
		if (arguments == null) {
			nodes.add(new LayoutText(variable));
			nodes.addAll(separatorNodes);
			nodes.add(new LayoutText(".."));
			return nodes;
		}
		List<PrintTree> elements = argument(variable);
		if (elements.isEmpty()) {
			throw new IllegalArgumentException(variable + " is bound to an empty list");
		}
		for (int i = 0; i < elements.size(); i++) {
			if (i > 0) {
				nodes.addAll(separatorNodes);
			}
			nodes.addAll(layoutTree(elements.get(i), constraint));
		}
		return nodes;
	}

	@Override
	public List<LayoutNode> visit(UnparsingLiteral unparsingLiteral) {
		return Collections.singletonList(new LayoutText(unparsingLiteral.getText()));
	}

	@Override
	public List<LayoutNode> visit(UnparsingCut unparsingCut) {
		boolean forced = unparsingCut.getKind() == UnparsingCut.Kind.FORCED_NEWLINE;
		return Collections.singletonList(new LayoutCut(forced, unparsingCut.getWidth(), unparsingCut.getIndent()));
	}

	@Override
	public List<LayoutNode> visit(UnparsingBox unparsingBox) {
		return Collections.singletonList(new LayoutBox(unparsingBox.getKind(), unparsingBox.getIndent(),
				layoutAll(unparsingBox.getChildren())));
	}

	@Override
	public List<LayoutNode> visit(UnparsingMetaVariable unparsingMetaVariable) {
		return single(unparsingMetaVariable.getVariable(), unparsingMetaVariable.getConstraint());
	}

	@Override
	public List<LayoutNode> visit(UnparsingListMetaVariable unparsingListMetaVariable) {
		return list(unparsingListMetaVariable.getVariable(), unparsingListMetaVariable.getConstraint(),
				unparsingListMetaVariable.getSeparator());
	}

	@Override
	public List<LayoutNode> visit(UnparsingBinderMetaVariable unparsingBinderMetaVariable) {
		return single(unparsingBinderMetaVariable.getVariable(), PrecedenceConstraint.unconstrained());
	}

	@Override
	public List<LayoutNode> visit(UnparsingBinderListMetaVariable unparsingBinderListMetaVariable) {
		return list(unparsingBinderListMetaVariable.getVariable(), PrecedenceConstraint.unconstrained(),
				unparsingBinderListMetaVariable.getSeparator());
	}
}
