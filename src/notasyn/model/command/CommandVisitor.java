package notasyn.model.command;

public abstract class CommandVisitor<T, E extends Throwable> {

	public abstract T visit(DeclareScopeCommand declareScopeCommand) throws E;
	public abstract T visit(DeclareCustomEntryCommand declareCustomEntryCommand) throws E;
	public abstract T visit(NotationCommand notationCommand) throws E;
	public abstract T visit(InfixCommand infixCommand) throws E;
	public abstract T visit(DelimitScopeCommand delimitScopeCommand) throws E;
	public abstract T visit(BindScopeCommand bindScopeCommand) throws E;
	public abstract T visit(AbbreviationCommand abbreviationCommand) throws E;
}
