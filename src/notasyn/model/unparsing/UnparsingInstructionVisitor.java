package notasyn.model.unparsing;

public abstract class UnparsingInstructionVisitor<T, E extends Throwable> {

	public abstract T visit(UnparsingLiteral unparsingLiteral) throws E;
	public abstract T visit(UnparsingCut unparsingCut) throws E;
	public abstract T visit(UnparsingBox unparsingBox) throws E;
	public abstract T visit(UnparsingMetaVariable unparsingMetaVariable) throws E;
	public abstract T visit(UnparsingListMetaVariable unparsingListMetaVariable) throws E;
	public abstract T visit(UnparsingBinderMetaVariable unparsingBinderMetaVariable) throws E;
	public abstract T visit(UnparsingBinderListMetaVariable unparsingBinderListMetaVariable) throws E;

}
