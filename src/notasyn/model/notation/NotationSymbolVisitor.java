package notasyn.model.notation;

public abstract class NotationSymbolVisitor<T, E extends Throwable> {

	public abstract T visit(NotationTerminal notationTerminal) throws E;
	public abstract T visit(NotationVariable notationVariable) throws E;
	public abstract T visit(NotationBreak notationBreak) throws E;
	public abstract T visit(NotationRecursiveList notationRecursiveList) throws E;

}
