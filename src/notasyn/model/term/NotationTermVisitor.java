package notasyn.model.term;

public abstract class NotationTermVisitor<T, E extends Throwable> {

	public abstract T visit(TermVariable termVariable) throws E;
	public abstract T visit(TermReference termReference) throws E;
	public abstract T visit(TermApplication termApplication) throws E;
	public abstract T visit(TermHole termHole) throws E;
	public abstract T visit(TermOpaque termOpaque) throws E;

}
