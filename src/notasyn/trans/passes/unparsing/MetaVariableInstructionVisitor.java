package notasyn.trans.passes.unparsing;

import notasyn.model.notation.*;
import notasyn.model.unparsing.UnparsingBinderMetaVariable;
import notasyn.model.unparsing.UnparsingInstruction;
import notasyn.model.unparsing.UnparsingMetaVariable;
import notasyn.trans.passes.entry.PrecedenceTable;

/**
 * Computes the instruction printing the sub-term bound to one variable, given the variable's entry type.
 */
public class MetaVariableInstructionVisitor extends EntryTypeVisitor<UnparsingInstruction, RuntimeException> {

	private final String variable;
	private final int notationLevel;

	public MetaVariableInstructionVisitor(String variable, int notationLevel) {
		this.variable = variable;
		this.notationLevel = notationLevel;
	}

	private UnparsingInstruction term(EntryType type) {
		return new UnparsingMetaVariable(variable, PrecedenceTable.forPrinting(notationLevel, type));
	}

	@Override
	public UnparsingInstruction visit(SubExpressionEntryType subExpressionEntryType) throws RuntimeException {
		return term(subExpressionEntryType);
	}

	@Override
	public UnparsingInstruction visit(IdentEntryType identEntryType) throws RuntimeException {
		return term(identEntryType);
	}

	@Override
	public UnparsingInstruction visit(NameEntryType nameEntryType) throws RuntimeException {
		return new UnparsingBinderMetaVariable(variable, false);
	}

	@Override
	public UnparsingInstruction visit(BinderEntryType binderEntryType) throws RuntimeException {
		return new UnparsingBinderMetaVariable(variable, true);
	}

	@Override
	public UnparsingInstruction visit(PatternEntryType patternEntryType) throws RuntimeException {
		return new UnparsingBinderMetaVariable(variable, false);
	}

	@Override
	public UnparsingInstruction visit(GlobalReferenceEntryType globalReferenceEntryType) throws RuntimeException {
		return term(globalReferenceEntryType);
	}

	@Override
	public UnparsingInstruction visit(LiteralEntryType literalEntryType) throws RuntimeException {
		return term(literalEntryType);
	}
}
