package notasyn.formatters;

import notasyn.errors.ContextVisitor;
import notasyn.trans.WhileLoadingDeclaration;
import notasyn.trans.WhileRegisteringNotation;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileRegisteringNotation whileRegisteringNotation) throws IOException {
		out.write("while registering \"");
		out.write(whileRegisteringNotation.getPattern());
		out.write("\"");
		return null;
	}

	@Override
	public Void visit(WhileLoadingDeclaration whileLoadingDeclaration) throws IOException {
		out.write("while loading declaration ");
		out.write(Integer.toString(whileLoadingDeclaration.getIndex() + 1));
		out.write(" of ");
		out.write(whileLoadingDeclaration.getFile());
		return null;
	}
}
