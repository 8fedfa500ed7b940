package notasyn.model.grammar;

public abstract class ProductionElementVisitor<T, E extends Throwable> {

	public abstract T visit(TerminalElement terminalElement) throws E;
	public abstract T visit(NonTerminalElement nonTerminalElement) throws E;
	public abstract T visit(ListElement listElement) throws E;
	public abstract T visit(BinderListElement binderListElement) throws E;
	public abstract T visit(ListMark listMark) throws E;

}
