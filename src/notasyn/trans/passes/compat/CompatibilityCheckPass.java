package notasyn.trans.passes.compat;

import notasyn.errors.IssueContext;
import notasyn.grammar.GrammarEngine;
import notasyn.model.grammar.GrammarRule;
import notasyn.model.notation.*;
import notasyn.model.unparsing.PrintingRule;
import notasyn.state.NotationRegistry;
import notasyn.state.ScopeTable;


/**
 * Compares a syntax extension with what is already registered for its key.
 *
 * A key keeps the level it was first registered at: any other level, or other sub-entries, is an
 * error. Its grammar rule is installed once. A different printing rule replaces the previous one,
 * with a warning.
 */
public class CompatibilityCheckPass {

	private CompatibilityCheckPass() {}

	/**
	 * @return what to install, or null after reporting an issue
	 */
	public static CompatibilityDecision perform(IssueContext ctx, NotationRegistry notations, GrammarEngine grammar,
												SyntaxExtension extension) {
		ParsingExtension parsing = extension.getParsing();
		NotationKey key = parsing.getKey();

		Level previous = notations.getLevel(key);
		boolean declareLevel = previous == null;
		if (previous != null && (!previous.equals(parsing.getLevel())
				|| !notations.getSubentries(key).equals(parsing.getSubentries()))) {
			ctx.error(new IncompatibleLevelRedeclarationIssue(key, previous, notations.getSubentries(key),
					parsing.getLevel(), parsing.getSubentries()));
			return null;
		}

		GrammarRule rule = parsing.getRule();
		boolean installGrammar = rule != null && notations.getGrammarRule(key) == null;
		if (installGrammar && !checkLevelAssociativity(ctx, grammar, rule)) {
			return null;
		}

		boolean installPrinting = false;
		PrintingExtension printing = extension.getPrinting();
		if (printing != null) {
			PrintingExtension existing = notations.getPrintingRule(key);
			installPrinting = existing == null || !existing.getRule().equals(printing.getRule());
			// a different rule always replaces the registered one, reserved or not
			if (existing != null && installPrinting) {
				ctx.warning(new IncompatibleFormatRedeclarationIssue(key, null));
			}
		}
		return new CompatibilityDecision(declareLevel, installGrammar, installPrinting);
	}

	/**
	 * @return whether a printing rule specific to the scope has to be installed
	 */
	public static boolean checkSpecificPrinting(IssueContext ctx, NotationRegistry notations, String scope,
												NotationKey key, PrintingRule rule) {
		PrintingRule existing = notations.getSpecificPrintingRule(scope, key);
		if (existing == null) {
			return true;
		}
		if (existing.equals(rule)) {
			return false;
		}
		ctx.warning(new IncompatibleFormatRedeclarationIssue(key, scope));
		return true;
	}

	/**
	 * A level of a grammar entry has one associativity; a rule asking for another one cannot share it.
	 */
	private static boolean checkLevelAssociativity(IssueContext ctx, GrammarEngine grammar, GrammarRule rule) {
		Associativity existing = grammar.getLevelAssociativity(rule.getEntry(), rule.getLevel());
		if (existing != null && rule.getAssociativity() != null && existing != rule.getAssociativity()) {
			ctx.error(new LevelAssociativityIssue(rule.getEntry(), rule.getLevel(), existing, rule.getAssociativity()));
			return false;
		}
		return true;
	}

	/**
	 * @return whether the entry exists in the grammar
	 */
	public static boolean checkEntry(IssueContext ctx, GrammarEngine grammar, NotationEntry entry) {
		if (entry.isCustom() && grammar.lookupEntry(entry.getGrammarName()) == null) {
			ctx.error(new UnknownCustomEntryIssue(entry.getCustomName()));
			return false;
		}
		return true;
	}

	/**
	 * Declares a scope that was used before being declared, with a warning.
	 */
	public static void ensureScope(IssueContext ctx, ScopeTable scopes, String scope) {
		if (!scopes.ensureScope(scope)) {
			ctx.warning(new UndeclaredScopeIssue(scope));
		}
	}
}
