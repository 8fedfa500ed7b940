package notasyn.trans.passes.printability;

import notasyn.model.term.*;

import java.util.Set;

/**
 * Collects the variables an interpretation mentions, and the first construct in it that cannot
 * be matched back when printing.
 */
public class ReversibilityVisitor extends NotationTermVisitor<Void, RuntimeException> {

	private final Set<String> variables;
	private TermOpaque firstOpaque;

	public ReversibilityVisitor(Set<String> variables) {
		this.variables = variables;
	}

	/**
	 * @return the first opaque construct met, or null
	 */
	public TermOpaque getFirstOpaque() {
		return firstOpaque;
	}

	@Override
	public Void visit(TermVariable termVariable) throws RuntimeException {
		variables.add(termVariable.getName());
		return null;
	}

	@Override
	public Void visit(TermReference termReference) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(TermApplication termApplication) throws RuntimeException {
		termApplication.getHead().accept(this);
		for (NotationTerm argument : termApplication.getArguments()) {
			argument.accept(this);
		}
		return null;
	}

	@Override
	public Void visit(TermHole termHole) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(TermOpaque termOpaque) throws RuntimeException {
		if (firstOpaque == null) {
			firstOpaque = termOpaque;
		}
		for (NotationTerm subterm : termOpaque.getSubterms()) {
			subterm.accept(this);
		}
		return null;
	}
}
