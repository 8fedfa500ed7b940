package notasyn.library;

import notasyn.errors.IssueContext;
import notasyn.model.grammar.BinderListElement;
import notasyn.model.grammar.GrammarRule;
import notasyn.model.grammar.ListElement;
import notasyn.model.grammar.Production;
import notasyn.model.grammar.ProductionElement;
import notasyn.model.grammar.TerminalElement;
import notasyn.model.notation.Associativity;
import notasyn.model.notation.NotationTokens;
import notasyn.model.notation.ParsingExtension;
import notasyn.model.notation.SyntaxExtension;
import notasyn.state.GrammarState;
import notasyn.state.NotationRegistry;
import notasyn.trans.passes.compat.CompatibilityCheckPass;
import notasyn.trans.passes.compat.CompatibilityDecision;

import java.util.logging.Logger;

/**
 * Installs the grammar and printing rules of a notation. Grammar productions go in before the
 * printing rule, and only the first time the key's grammar part is registered.
 */
public class SyntaxExtensionObject implements LibraryObject<SyntaxExtensionObject.Declaration> {

	private static final Logger logger = Logger.getLogger("notasyn.library");

	public static final class Declaration {
		private final boolean local;
		private final SyntaxExtension extension;

		public Declaration(boolean local, SyntaxExtension extension) {
			this.local = local;
			this.extension = extension;
		}

		public boolean isLocal() {
			return local;
		}

		public SyntaxExtension getExtension() {
			return extension;
		}

		@Override
		public String toString() {
			return extension.getKey().toString();
		}
	}

	private final GrammarState state;
	private final IssueContext ctx;

	public SyntaxExtensionObject(GrammarState state, IssueContext ctx) {
		this.state = state;
		this.ctx = ctx;
	}

	@Override
	public String getName() {
		return "SYNTAX-EXTENSION";
	}

	@Override
	public void declare(Declaration artifact) {
		// nothing to make known before caching
	}

	@Override
	public void cache(Declaration artifact) {
		install(artifact);
	}

	@Override
	public void open(int phase, Declaration artifact) {
		if (phase == 1 && !ctx.hasErrors()) {
			install(artifact);
		}
	}

	private void install(Declaration artifact) {
		SyntaxExtension extension = artifact.getExtension();
		NotationRegistry notations = state.getNotations();
		CompatibilityDecision decision = CompatibilityCheckPass.perform(ctx, notations, state.getGrammar(), extension);
		if (decision == null || decision.isNoOp()) {
			return;
		}
		ParsingExtension parsing = extension.getParsing();
		if (decision.isDeclareLevel()) {
			notations.declareLevel(parsing.getKey(), parsing.getLevel(), parsing.getSubentries());
		}
		if (decision.isInstallGrammar()) {
			GrammarRule rule = parsing.getRule();
			notations.declareGrammarRule(parsing.getKey(), rule);
			Associativity associativity = rule.getAssociativity() == null ? Associativity.LEFT : rule.getAssociativity();
			for (Production production : rule.getProductions()) {
				registerSymbolTokens(production);
				state.getGrammar().addProduction(rule.getEntry(), rule.getLevel(), associativity, production);
			}
			logger.fine("Installed " + rule.getProductions().size() + " production(s) for " + parsing.getKey());
		}
		if (decision.isInstallPrinting()) {
			notations.declarePrintingRule(parsing.getKey(), extension.getPrinting());
		}
	}

	/**
	 * Terminals that are not identifiers always become tokens of the lexer.
	 */
	private void registerSymbolTokens(Production production) {
		for (ProductionElement element : production.getElements()) {
			if (element instanceof TerminalElement) {
				registerSymbolToken((TerminalElement) element);
			} else if (element instanceof ListElement) {
				((ListElement) element).getSeparator().forEach(this::registerSymbolToken);
			} else if (element instanceof BinderListElement) {
				((BinderListElement) element).getSeparator().forEach(this::registerSymbolToken);
			}
		}
	}

	private void registerSymbolToken(TerminalElement terminal) {
		if (!NotationTokens.isIdent(terminal.getText())) {
			state.getTokens().register(terminal.getText());
		}
	}

	@Override
	public Declaration substitute(Substitution substitution, Declaration artifact) {
		return artifact;
	}

	@Override
	public Classification classify(Declaration artifact) {
		return artifact.isLocal() ? Classification.DISPOSE : Classification.KEEP;
	}
}
