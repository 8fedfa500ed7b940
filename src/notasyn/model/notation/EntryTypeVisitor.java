package notasyn.model.notation;

public abstract class EntryTypeVisitor<T, E extends Throwable> {

	public abstract T visit(SubExpressionEntryType subExpressionEntryType) throws E;
	public abstract T visit(IdentEntryType identEntryType) throws E;
	public abstract T visit(NameEntryType nameEntryType) throws E;
	public abstract T visit(BinderEntryType binderEntryType) throws E;
	public abstract T visit(PatternEntryType patternEntryType) throws E;
	public abstract T visit(GlobalReferenceEntryType globalReferenceEntryType) throws E;
	public abstract T visit(LiteralEntryType literalEntryType) throws E;

}
