package notasyn.trans.passes.grammar;

import notasyn.InternalCompilerError;
import notasyn.model.grammar.ProductionEntry;
import notasyn.model.notation.*;
import notasyn.trans.passes.entry.PrecedenceTable;

/**
 * Computes what the grammar calls into for a variable of a given entry type.
 */
public class ProductionEntryVisitor extends EntryTypeVisitor<ProductionEntry, RuntimeException> {

	private final NotationEntry notationEntry;
	private final int notationLevel;

	public ProductionEntryVisitor(NotationEntry notationEntry, int notationLevel) {
		this.notationEntry = notationEntry;
		this.notationLevel = notationLevel;
	}

	@Override
	public ProductionEntry visit(SubExpressionEntryType subExpressionEntryType) throws RuntimeException {
		PrecedenceConstraint constraint = PrecedenceTable.forGrammar(notationEntry, notationLevel, subExpressionEntryType);
		if (constraint == null) {
			throw new InternalCompilerError("next level of another entry should have been rejected");
		}
		return ProductionEntry.subExpression(subExpressionEntryType.getEntry(), constraint);
	}

	@Override
	public ProductionEntry visit(IdentEntryType identEntryType) throws RuntimeException {
		return ProductionEntry.simple(ProductionEntry.Kind.IDENT);
	}

	@Override
	public ProductionEntry visit(NameEntryType nameEntryType) throws RuntimeException {
		return ProductionEntry.simple(ProductionEntry.Kind.NAME);
	}

	@Override
	public ProductionEntry visit(BinderEntryType binderEntryType) throws RuntimeException {
		return ProductionEntry.binder(binderEntryType.isOpen());
	}

	@Override
	public ProductionEntry visit(PatternEntryType patternEntryType) throws RuntimeException {
		return ProductionEntry.pattern(patternEntryType.getLevel() == null ? 0 : patternEntryType.getLevel());
	}

	@Override
	public ProductionEntry visit(GlobalReferenceEntryType globalReferenceEntryType) throws RuntimeException {
		return ProductionEntry.simple(ProductionEntry.Kind.REFERENCE);
	}

	@Override
	public ProductionEntry visit(LiteralEntryType literalEntryType) throws RuntimeException {
		return ProductionEntry.simple(ProductionEntry.Kind.BIGINT);
	}
}
