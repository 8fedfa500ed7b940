package notasyn.library;

import notasyn.model.term.*;

import java.util.ArrayList;
import java.util.List;

public class SubstitutionVisitor extends NotationTermVisitor<NotationTerm, RuntimeException> {

	private final Substitution substitution;

	public SubstitutionVisitor(Substitution substitution) {
		this.substitution = substitution;
	}

	private List<NotationTerm> all(List<NotationTerm> terms) {
		List<NotationTerm> result = new ArrayList<>();
		for (NotationTerm term : terms) {
			result.add(term.accept(this));
		}
		return result;
	}

	@Override
	public NotationTerm visit(TermVariable termVariable) throws RuntimeException {
		return termVariable;
	}

	@Override
	public NotationTerm visit(TermReference termReference) throws RuntimeException {
		return new TermReference(substitution.apply(termReference.getName()));
	}

	@Override
	public NotationTerm visit(TermApplication termApplication) throws RuntimeException {
		return new TermApplication(termApplication.getHead().accept(this), all(termApplication.getArguments()));
	}

	@Override
	public NotationTerm visit(TermHole termHole) throws RuntimeException {
		return termHole;
	}

	@Override
	public NotationTerm visit(TermOpaque termOpaque) throws RuntimeException {
		return new TermOpaque(termOpaque.getDescription(), all(termOpaque.getSubterms()));
	}
}
