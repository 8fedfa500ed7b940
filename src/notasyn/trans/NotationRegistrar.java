package notasyn.trans;

import notasyn.errors.Issue;
import notasyn.errors.IssueContext;
import notasyn.errors.TopLevelIssueContext;
import notasyn.library.AbbreviationObject;
import notasyn.library.CustomEntryObject;
import notasyn.library.NotationObject;
import notasyn.library.ScopeCommandObject;
import notasyn.library.SyntaxExtensionObject;
import notasyn.model.grammar.GrammarRule;
import notasyn.model.notation.*;
import notasyn.model.term.NotationTerm;
import notasyn.model.term.Reversibility;
import notasyn.model.term.TermBuilder;
import notasyn.model.unparsing.PrintingRule;
import notasyn.state.GrammarState;
import notasyn.state.StateProtection;
import notasyn.trans.passes.compat.CompatibilityCheckPass;
import notasyn.trans.passes.compat.CustomEntryExistsIssue;
import notasyn.trans.passes.compat.NoSyntaxRuleIssue;
import notasyn.trans.passes.decompose.NotationDecompositionPass;
import notasyn.trans.passes.entry.EntryTypeResolutionPass;
import notasyn.trans.passes.entry.ModifierIssue;
import notasyn.trans.passes.entry.ResolvedEntryTypes;
import notasyn.trans.passes.grammar.GrammarSynthesisPass;
import notasyn.trans.passes.precedence.NotationPrecedence;
import notasyn.trans.passes.precedence.PrecedenceResolutionPass;
import notasyn.trans.passes.printability.Printability;
import notasyn.trans.passes.printability.PrintabilityCheckPass;
import notasyn.trans.passes.unparsing.UnparsingSynthesisPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Registers notation declarations into a {@link GrammarState}.
 *
 * Each entry point runs the passes one after the other and stops at the first one reporting an
 * error, throwing a {@link NotationRegistrationException}. The state is then left exactly as it was
 * before the call. Warnings of successful registrations accumulate in {@link #getWarnings()}.
 */
public class NotationRegistrar {

	private static final Logger logger = Logger.getLogger("notasyn.registrar");

	private final GrammarState state;
	private final List<Issue> warnings;

	public NotationRegistrar(GrammarState state) {
		this.state = state;
		this.warnings = new ArrayList<>();
	}

	public GrammarState getState() {
		return state;
	}

	public List<Issue> getWarnings() {
		return Collections.unmodifiableList(warnings);
	}

	/**
	 * The issues of one registration, and the check run between two passes.
	 */
	private static final class Registration {
		private final TopLevelIssueContext issues;
		private final IssueContext ctx;

		private Registration(String pattern) {
			this.issues = new TopLevelIssueContext();
			this.ctx = issues.withContext(new WhileRegisteringNotation(pattern));
		}

		private void checkErrors() {
			if (issues.hasErrors()) {
				throw new NotationRegistrationException(new ArrayList<>(issues.getIssues()));
			}
		}
	}

	private interface Stages<R> {
		R run(Registration registration);
	}

	private <R> R register(String pattern, Stages<R> stages) {
		Registration registration = new Registration(pattern);
		try (StateProtection protection = state.protect()) {
			R result = stages.run(registration);
			registration.checkErrors();
			protection.commit();
			warnings.addAll(registration.issues.getWarnings());
			return result;
		}
	}

	/**
	 * The syntax computed for a declaration: everything the passes derive from the pattern and
	 * the modifiers. The extension is null when the syntax was already registered.
	 */
	private static final class Syntax {
		private final DecomposedNotation notation;
		private final NotationKey key;
		private final Level level;
		private final List<EntryType> subentries;
		private final PrintingRule printing;
		private final SyntaxExtension extension;
		// false when no production parses the notation
		private final boolean parsable;

		private Syntax(DecomposedNotation notation, NotationKey key, Level level, List<EntryType> subentries,
					   PrintingRule printing, SyntaxExtension extension, boolean parsable) {
			this.notation = notation;
			this.key = key;
			this.level = level;
			this.subentries = subentries;
			this.printing = printing;
			this.extension = extension;
			this.parsable = parsable;
		}
	}

	/**
	 * Declares a notation without interpretation: its grammar and printing rules only.
	 */
	public SyntaxExtension addSyntaxExtension(NotationDeclaration declaration) {
		return register(declaration.getPattern(), registration -> {
			Syntax syntax = computeSyntax(registration, declaration.getPattern(), declaration.getModifiers(), true);
			addSyntaxLeaf(registration, syntax.extension, declaration.isLocal());
			logger.fine("Reserved notation " + syntax.key);
			return syntax.extension;
		});
	}

	/**
	 * Declares a notation with its interpretation. When the modifiers do not change the syntax and a
	 * syntax is already registered for the pattern, that syntax is reused.
	 *
	 * @return the interpretation, or null when it is used neither for parsing nor for printing
	 */
	public NotationInterpretation addNotation(NotationDeclaration declaration) {
		if (declaration.getInterpretation() == null) {
			throw new IllegalArgumentException("notation \"" + declaration.getPattern() + "\" has no interpretation");
		}
		return register(declaration.getPattern(), registration -> notation(registration, declaration));
	}

	/**
	 * Adds an interpretation to a notation whose syntax is already registered. Only the only-parsing
	 * and only-printing modifiers are taken into account.
	 *
	 * @return the interpretation, or null when it is used neither for parsing nor for printing
	 */
	public NotationInterpretation addNotationInterpretation(NotationDeclaration declaration) {
		if (declaration.getInterpretation() == null) {
			throw new IllegalArgumentException("notation \"" + declaration.getPattern() + "\" has no interpretation");
		}
		return register(declaration.getPattern(), registration -> {
			Syntax syntax = registeredSyntax(registration, declaration.getPattern(), declaration.getModifiers());
			return interpret(registration, declaration, syntax, false);
		});
	}

	/**
	 * Declares the binary notation "x op y" standing for the application of the head to both operands.
	 */
	public NotationInterpretation addInfix(String operator, NotationModifiers modifiers, NotationTerm head,
										   String scope, boolean local) {
		return addInfix(operator, modifiers, head, scope, local, null);
	}

	public NotationInterpretation addInfix(String operator, NotationModifiers modifiers, NotationTerm head,
										   String scope, boolean local, Deprecation deprecation) {
		String pattern = "x " + NotationTokens.quote(operator) + " y";
		return register(pattern, registration -> {
			if (modifiers.hasEntryTypeModifiers()) {
				registration.ctx.error(new ModifierIssue(ModifierIssue.Reason.ENTRY_TYPE_IN_INFIX, null));
				registration.checkErrors();
			}
			NotationTerm interpretation = TermBuilder.app(head, TermBuilder.var("x"), TermBuilder.var("y"));
			return notation(registration, new NotationDeclaration(pattern, modifiers, interpretation, scope, local,
					deprecation));
		});
	}

	public void declareScope(String scope, boolean local) {
		scopeCommand(ScopeCommandObject.Declaration.declare(local, scope));
	}

	/**
	 * Gives the scope a delimiting key, so that {@code (t)%key} interprets t in the scope.
	 */
	public void addDelimiters(String scope, String key, boolean local) {
		scopeCommand(ScopeCommandObject.Declaration.addDelimiter(local, scope, key));
	}

	public void removeDelimiters(String scope, boolean local) {
		scopeCommand(ScopeCommandObject.Declaration.removeDelimiter(local, scope));
	}

	/**
	 * Interprets the arguments expected to be of one of the classes in the scope.
	 */
	public void addClassScope(String scope, List<String> classes, boolean local) {
		scopeCommand(ScopeCommandObject.Declaration.bindClasses(local, scope, classes));
	}

	private void scopeCommand(ScopeCommandObject.Declaration declaration) {
		register(declaration.getScope(), registration -> {
			state.getLibrary().addLeaf(new ScopeCommandObject(state, registration.ctx), declaration);
			registration.checkErrors();
			return null;
		});
	}

	/**
	 * Declares a name standing for a term of its parameters. An abbreviation whose body cannot be
	 * matched back against terms is only used for parsing, with a warning.
	 */
	public Abbreviation addAbbreviation(String name, List<String> parameters, NotationTerm body, boolean onlyParsing,
										Deprecation deprecation, boolean local) {
		return register(name, registration -> {
			Reversibility reversibility = PrintabilityCheckPass.reversibility(parameters, body);
			Printability printability = PrintabilityCheckPass.perform(registration.ctx, name, null,
					Collections.emptyList(), onlyParsing, body, reversibility);
			registration.checkErrors();
			Abbreviation abbreviation = new Abbreviation(name, parameters, body, printability.isOnlyParsing(),
					deprecation, local);
			state.getLibrary().addLeaf(new AbbreviationObject(state), abbreviation);
			logger.fine("Declared abbreviation " + abbreviation);
			return abbreviation;
		});
	}

	public void declareCustomEntry(String name, boolean local) {
		register(name, registration -> {
			if (state.getGrammar().lookupEntry(NotationEntry.custom(name).getGrammarName()) != null) {
				registration.ctx.error(new CustomEntryExistsIssue(name));
				registration.checkErrors();
			}
			return state.getLibrary().addLeaf(new CustomEntryObject(state), new CustomEntryObject.Declaration(local, name));
		});
	}

	/**
	 * Attaches a printing directive of another printer to the printing rule of a notation.
	 *
	 * @return the updated printing rule
	 */
	public PrintingRule addExtraPrintingRule(String pattern, NotationEntry entry, String key, String value) {
		return register(pattern, registration -> {
			DecomposedNotation notation = NotationDecompositionPass.perform(registration.ctx, pattern, entry, false);
			registration.checkErrors();
			NotationKey notationKey = notation.getKey(entry);
			PrintingExtension existing = state.getNotations().getPrintingRule(notationKey);
			if (existing == null) {
				registration.ctx.error(new NoSyntaxRuleIssue(notationKey));
				registration.checkErrors();
			}
			Map<String, String> extra = new LinkedHashMap<>(existing.getRule().getExtra());
			extra.put(key, value);
			PrintingRule rule = new PrintingRule(existing.getRule().getInstructions(), extra);
			state.getNotations().declarePrintingRule(notationKey, new PrintingExtension(existing.isReserved(), rule));
			return rule;
		});
	}

	private NotationInterpretation notation(Registration registration, NotationDeclaration declaration) {
		Syntax syntax = null;
		if (!declaration.getModifiers().affectsSyntax()) {
			syntax = findRegisteredSyntax(registration, declaration.getPattern(), declaration.getModifiers());
		}
		if (syntax == null) {
			syntax = computeSyntax(registration, declaration.getPattern(), declaration.getModifiers(), false);
		}
		return interpret(registration, declaration, syntax, true);
	}

	/**
	 * Checks whether the interpretation can be printed, then registers the syntax if it is new, and
	 * the interpretation.
	 */
	private NotationInterpretation interpret(Registration registration, NotationDeclaration declaration, Syntax syntax,
											 boolean withSyntax) {
		NotationModifiers modifiers = declaration.getModifiers();
		Level level = syntax.notation.isNumeral() ? null : syntax.level;
		Reversibility reversibility = PrintabilityCheckPass.reversibility(
				syntax.notation.getMainVariables(), declaration.getInterpretation());
		Printability printability = PrintabilityCheckPass.perform(registration.ctx, declaration.getPattern(), level,
				syntax.subentries, modifiers.isOnlyParsing(), declaration.getInterpretation(), reversibility);
		registration.checkErrors();
		NotationUse use = PrintabilityCheckPass.makeUse(registration.ctx, declaration.getPattern(), withSyntax,
				printability.isOnlyParsing(), modifiers.isOnlyPrinting() || !syntax.parsable);
		if (use == null) {
			return null;
		}

		if (syntax.extension != null) {
			addSyntaxLeaf(registration, syntax.extension, declaration.isLocal());
		}
		PrintingRule specific = declaration.getScope() != null && syntax.extension != null ? syntax.printing : null;
		NotationInterpretation interpretation = new NotationInterpretation(syntax.key, declaration.getPattern(),
				declaration.getScope(), use, declaration.getInterpretation(), printability.getCoercion(), specific,
				declaration.isLocal(), declaration.getDeprecation());
		state.getLibrary().addLeaf(new NotationObject(state, registration.ctx), interpretation);
		registration.checkErrors();
		logger.fine("Interpreted " + syntax.key + " as " + declaration.getInterpretation());
		return interpretation;
	}

	private void addSyntaxLeaf(Registration registration, SyntaxExtension extension, boolean local) {
		state.getLibrary().addLeaf(new SyntaxExtensionObject(state, registration.ctx),
				new SyntaxExtensionObject.Declaration(local, extension));
		registration.checkErrors();
	}

	/**
	 * @return the registered syntax of the pattern, or null after reporting that there is none
	 */
	private Syntax registeredSyntax(Registration registration, String pattern, NotationModifiers modifiers) {
		Syntax syntax = findRegisteredSyntax(registration, pattern, modifiers);
		if (syntax == null) {
			DecomposedNotation notation = NotationDecompositionPass.perform(registration.ctx, pattern,
					modifiers.getEntry(), modifiers.isOnlyPrinting());
			registration.checkErrors();
			registration.ctx.error(new NoSyntaxRuleIssue(notation.getKey(modifiers.getEntry())));
			registration.checkErrors();
		}
		return syntax;
	}

	private Syntax findRegisteredSyntax(Registration registration, String pattern, NotationModifiers modifiers) {
		NotationEntry entry = modifiers.getEntry();
		DecomposedNotation notation = NotationDecompositionPass.perform(registration.ctx, pattern, entry,
				modifiers.isOnlyPrinting());
		registration.checkErrors();
		NotationKey key = notation.getKey(entry);
		Level level = state.getNotations().getLevel(key);
		if (level == null) {
			return null;
		}
		PrintingExtension printing = state.getNotations().getPrintingRule(key);
		boolean parsable = notation.isNumeral() || state.getNotations().getGrammarRule(key) != null;
		return new Syntax(notation, key, level, state.getNotations().getSubentries(key),
				printing == null ? null : printing.getRule(), null, parsable);
	}

	private Syntax computeSyntax(Registration registration, String pattern, NotationModifiers modifiers,
								 boolean reserved) {
		IssueContext ctx = registration.ctx;
		NotationEntry entry = modifiers.getEntry();
		CompatibilityCheckPass.checkEntry(ctx, state.getGrammar(), entry);
		registration.checkErrors();

		DecomposedNotation notation = NotationDecompositionPass.perform(ctx, pattern, entry, modifiers.isOnlyPrinting());
		registration.checkErrors();

		Map<String, EntryType> overrides = EntryTypeResolutionPass.interpretModifiers(ctx, notation, modifiers);
		registration.checkErrors();

		NotationPrecedence precedence = PrecedenceResolutionPass.perform(ctx, notation, modifiers, overrides);
		registration.checkErrors();

		ResolvedEntryTypes types = EntryTypeResolutionPass.perform(ctx, notation, overrides, entry,
				precedence.getLevel(), precedence.getAssociativity());
		registration.checkErrors();

		Associativity associativity = PrecedenceResolutionPass.recomputeAssociativity(ctx, notation,
				types.getSubentries());
		registration.checkErrors();

		NotationKey key = notation.getKey(entry);
		GrammarRule rule = null;
		if (!modifiers.isOnlyPrinting() && !notation.isNumeral()) {
			rule = grammarRule(registration, notation, overrides, types, precedence, associativity, entry);
		}

		PrintingRule printing = UnparsingSynthesisPass.perform(ctx, notation, types, precedence.getLevel(), modifiers);
		registration.checkErrors();

		PrintingExtension printingExtension = new PrintingExtension(reserved, printing);
		if (modifiers.isOnlyParsing() && state.getNotations().getPrintingRule(key) != null) {
			printingExtension = null;
		}
		ParsingExtension parsing = new ParsingExtension(key, types.getLevel(), rule, types.getSubentries());
		return new Syntax(notation, key, types.getLevel(), types.getSubentries(), printing,
				new SyntaxExtension(parsing, printingExtension), notation.isNumeral() || rule != null);
	}

	/**
	 * Builds the productions of a notation, from the pattern with its "{ x }" reduced to x when it
	 * lives in the main entry.
	 */
	private GrammarRule grammarRule(Registration registration, DecomposedNotation notation,
									Map<String, EntryType> overrides, ResolvedEntryTypes types,
									NotationPrecedence precedence, Associativity associativity, NotationEntry entry) {
		IssueContext ctx = registration.ctx;
		DecomposedNotation grammarNotation = notation;
		if (!entry.isCustom()) {
			grammarNotation = NotationDecompositionPass.squashCurlyBrackets(ctx, notation,
					state.getNotations().getGrammarRule(NotationDecompositionPass.CURLY_BRACKETS) != null);
			registration.checkErrors();
		}
		ResolvedEntryTypes grammarTypes = types;
		Associativity grammarAssociativity = associativity;
		if (grammarNotation != notation) {
			logger.fine("Parsing " + notation.getKey(entry) + " as " + grammarNotation.getKey(entry));
			grammarTypes = EntryTypeResolutionPass.perform(ctx, grammarNotation, overrides, entry,
					precedence.getLevel(), precedence.getAssociativity());
			registration.checkErrors();
			grammarAssociativity = PrecedenceResolutionPass.recomputeAssociativity(ctx, grammarNotation,
					grammarTypes.getSubentries());
			registration.checkErrors();
		}
		GrammarRule rule = GrammarSynthesisPass.perform(ctx, state.getTokens(), grammarNotation, grammarTypes,
				grammarNotation.getKey(entry), precedence.getLevel(), grammarAssociativity);
		registration.checkErrors();
		return rule;
	}
}
