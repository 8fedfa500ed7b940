package notasyn.trans;

import notasyn.model.command.*;

/**
 * Hands each command of a declaration file to the registrar.
 */
public class CommandRegistrationVisitor extends CommandVisitor<Void, RuntimeException> {

	private final NotationRegistrar registrar;

	public CommandRegistrationVisitor(NotationRegistrar registrar) {
		this.registrar = registrar;
	}

	@Override
	public Void visit(DeclareScopeCommand declareScopeCommand) {
		registrar.declareScope(declareScopeCommand.getScope(), declareScopeCommand.isLocal());
		return null;
	}

	@Override
	public Void visit(DeclareCustomEntryCommand declareCustomEntryCommand) {
		registrar.declareCustomEntry(declareCustomEntryCommand.getName(), declareCustomEntryCommand.isLocal());
		return null;
	}

	@Override
	public Void visit(NotationCommand notationCommand) {
		if (notationCommand.isReserved()) {
			registrar.addSyntaxExtension(notationCommand.getDeclaration());
		} else if (notationCommand.isInterpretationOnly()) {
			registrar.addNotationInterpretation(notationCommand.getDeclaration());
		} else {
			registrar.addNotation(notationCommand.getDeclaration());
		}
		return null;
	}

	@Override
	public Void visit(InfixCommand infixCommand) {
		registrar.addInfix(infixCommand.getOperator(), infixCommand.getModifiers(), infixCommand.getHead(),
				infixCommand.getScope(), infixCommand.isLocal(), infixCommand.getDeprecation());
		return null;
	}

	@Override
	public Void visit(DelimitScopeCommand delimitScopeCommand) {
		if (delimitScopeCommand.getKey() == null) {
			registrar.removeDelimiters(delimitScopeCommand.getScope(), delimitScopeCommand.isLocal());
		} else {
			registrar.addDelimiters(delimitScopeCommand.getScope(), delimitScopeCommand.getKey(),
					delimitScopeCommand.isLocal());
		}
		return null;
	}

	@Override
	public Void visit(BindScopeCommand bindScopeCommand) {
		registrar.addClassScope(bindScopeCommand.getScope(), bindScopeCommand.getClasses(), bindScopeCommand.isLocal());
		return null;
	}

	@Override
	public Void visit(AbbreviationCommand abbreviationCommand) {
		registrar.addAbbreviation(abbreviationCommand.getName(), abbreviationCommand.getParameters(),
				abbreviationCommand.getBody(), abbreviationCommand.isOnlyParsing(), abbreviationCommand.getDeprecation(),
				abbreviationCommand.isLocal());
		return null;
	}
}
