package notasyn.formatters;

import notasyn.model.unparsing.*;

import java.io.IOException;
import java.util.List;

public class UnparsingFormattingVisitor extends UnparsingInstructionVisitor<Void, IOException> {

	private final IndentingWriter out;

	public UnparsingFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(UnparsingLiteral unparsingLiteral) throws IOException {
		out.write("\"");
		out.write(unparsingLiteral.getText());
		out.write("\"");
		return null;
	}

	@Override
	public Void visit(UnparsingCut unparsingCut) throws IOException {
		if (unparsingCut.getKind() == UnparsingCut.Kind.FORCED_NEWLINE) {
			out.write("fnl");
		} else {
			out.write("brk(");
			out.write(Integer.toString(unparsingCut.getWidth()));
			out.write(",");
			out.write(Integer.toString(unparsingCut.getIndent()));
			out.write(")");
		}
		return null;
	}

	@Override
	public Void visit(UnparsingBox unparsingBox) throws IOException {
		out.write("[");
		out.write(unparsingBox.getKind().getName());
		out.write(" ");
		out.write(Integer.toString(unparsingBox.getIndent()));
		for (UnparsingInstruction child : unparsingBox.getChildren()) {
			out.write(" ");
			child.accept(this);
		}
		out.write("]");
		return null;
	}

	@Override
	public Void visit(UnparsingMetaVariable unparsingMetaVariable) throws IOException {
		out.write(unparsingMetaVariable.getVariable());
		out.write(":(");
		out.write(unparsingMetaVariable.getConstraint().toString());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(UnparsingListMetaVariable unparsingListMetaVariable) throws IOException {
		out.write(unparsingListMetaVariable.getVariable());
		out.write(":(");
		out.write(unparsingListMetaVariable.getConstraint().toString());
		out.write(")");
		writeList(unparsingListMetaVariable.getSeparator());
		return null;
	}

	@Override
	public Void visit(UnparsingBinderMetaVariable unparsingBinderMetaVariable) throws IOException {
		out.write(unparsingBinderMetaVariable.isQuoted() ? "binder " : "pattern ");
		out.write(unparsingBinderMetaVariable.getVariable());
		return null;
	}

	@Override
	public Void visit(UnparsingBinderListMetaVariable unparsingBinderListMetaVariable) throws IOException {
		out.write(unparsingBinderListMetaVariable.isOpen() ? "binders " : "closed binders ");
		out.write(unparsingBinderListMetaVariable.getVariable());
		writeList(unparsingBinderListMetaVariable.getSeparator());
		return null;
	}

	private void writeList(List<UnparsingInstruction> separator) throws IOException {
		out.write(" {");
		boolean first = true;
		for (UnparsingInstruction instruction : separator) {
			if (!first) {
				out.write(" ");
			}
			first = false;
			instruction.accept(this);
		}
		out.write("} ..");
	}
}
