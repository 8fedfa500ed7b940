package notasyn.formatters;

import notasyn.model.notation.*;

import java.io.IOException;
import java.util.List;

public class NotationSymbolFormattingVisitor extends NotationSymbolVisitor<Void, IOException> {

	private final IndentingWriter out;

	public NotationSymbolFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(NotationTerminal notationTerminal) throws IOException {
		out.write(NotationTokens.quote(notationTerminal.getText()));
		return null;
	}

	@Override
	public Void visit(NotationVariable notationVariable) throws IOException {
		out.write(notationVariable.getName());
		return null;
	}

	@Override
	public Void visit(NotationBreak notationBreak) throws IOException {
		out.write("<break ");
		out.write(Integer.toString(notationBreak.getWidth()));
		out.write(">");
		return null;
	}

	@Override
	public Void visit(NotationRecursiveList notationRecursiveList) throws IOException {
		out.write(notationRecursiveList.getVariable());
		writeSeparator(notationRecursiveList.getSeparator());
		out.write(" ..");
		writeSeparator(notationRecursiveList.getSeparator());
		return null;
	}

	private void writeSeparator(List<NotationSymbol> separator) throws IOException {
		for (NotationSymbol symbol : separator) {
			out.write(" ");
			symbol.accept(this);
		}
	}
}
