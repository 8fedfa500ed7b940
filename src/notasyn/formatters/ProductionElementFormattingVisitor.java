package notasyn.formatters;

import notasyn.model.grammar.*;

import java.io.IOException;
import java.util.List;

public class ProductionElementFormattingVisitor extends ProductionElementVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ProductionElementFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(TerminalElement terminalElement) throws IOException {
		if (terminalElement.isKeyword()) {
			out.write("\"");
			out.write(terminalElement.getText());
			out.write("\"");
		} else {
			out.write("IDENT \"");
			out.write(terminalElement.getText());
			out.write("\"");
		}
		return null;
	}

	@Override
	public Void visit(NonTerminalElement nonTerminalElement) throws IOException {
		out.write(nonTerminalElement.getVariable());
		out.write(":[");
		out.write(nonTerminalElement.getEntry().toString());
		out.write("]");
		return null;
	}

	@Override
	public Void visit(ListElement listElement) throws IOException {
		out.write("LIST1 ");
		out.write(listElement.getVariable());
		out.write(":[");
		out.write(listElement.getEntry().toString());
		out.write("]");
		writeSeparator(listElement.getSeparator());
		return null;
	}

	@Override
	public Void visit(BinderListElement binderListElement) throws IOException {
		out.write(binderListElement.isOpen() ? "binders " : "closed binders ");
		out.write(binderListElement.getVariable());
		writeSeparator(binderListElement.getSeparator());
		return null;
	}

	@Override
	public Void visit(ListMark listMark) throws IOException {
		out.write("{list ");
		out.write(Integer.toString(listMark.getCount()));
		if (listMark.isContinued()) {
			out.write("+");
		}
		out.write(", ");
		out.write(Integer.toString(listMark.getTrailing()));
		out.write(" trailing}");
		return null;
	}

	private void writeSeparator(List<TerminalElement> separator) throws IOException {
		if (separator.isEmpty()) {
			return;
		}
		out.write(" SEP");
		for (TerminalElement terminal : separator) {
			out.write(" ");
			terminal.accept(this);
		}
	}
}
