package notasyn.errors;

import notasyn.trans.IOErrorIssue;
import notasyn.trans.passes.compat.*;
import notasyn.trans.passes.decompose.CurlyBracketsIssue;
import notasyn.trans.passes.decompose.DuplicateVariableIssue;
import notasyn.trans.passes.decompose.RecursivePatternIssue;
import notasyn.trans.passes.entry.InvalidSubentryLevelIssue;
import notasyn.trans.passes.entry.ModifierIssue;
import notasyn.trans.passes.entry.ScopeMismatchIssue;
import notasyn.trans.passes.entry.UnboundVariableIssue;
import notasyn.trans.passes.grammar.NonProductiveRuleIssue;
import notasyn.trans.passes.parse.declaration.DeclarationParsingIssue;
import notasyn.trans.passes.parse.option.OptionParserIssue;
import notasyn.trans.passes.precedence.AmbiguousLevelIssue;
import notasyn.trans.passes.precedence.ContradictoryAssociativityIssue;
import notasyn.trans.passes.precedence.InvalidLeftmostFormIssue;
import notasyn.trans.passes.printability.NonInjectiveInterpretationIssue;
import notasyn.trans.passes.printability.OpaqueInterpretationIssue;
import notasyn.trans.passes.printability.UnusedInterpretationIssue;
import notasyn.trans.passes.printability.VariableBoundNotationIssue;
import notasyn.trans.passes.unparsing.DiscardedNotationBreakIssue;
import notasyn.trans.passes.unparsing.FormatMismatchIssue;
import notasyn.trans.passes.unparsing.IgnoredFormatIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(DeclarationParsingIssue declarationParsingIssue) throws E;
	public abstract T visit(DuplicateVariableIssue duplicateVariableIssue) throws E;
	public abstract T visit(RecursivePatternIssue recursivePatternIssue) throws E;
	public abstract T visit(AmbiguousLevelIssue ambiguousLevelIssue) throws E;
	public abstract T visit(InvalidLeftmostFormIssue invalidLeftmostFormIssue) throws E;
	public abstract T visit(ContradictoryAssociativityIssue contradictoryAssociativityIssue) throws E;
	public abstract T visit(UnboundVariableIssue unboundVariableIssue) throws E;
	public abstract T visit(ScopeMismatchIssue scopeMismatchIssue) throws E;
	public abstract T visit(InvalidSubentryLevelIssue invalidSubentryLevelIssue) throws E;
	public abstract T visit(ModifierIssue modifierIssue) throws E;
	public abstract T visit(NonProductiveRuleIssue nonProductiveRuleIssue) throws E;
	public abstract T visit(FormatMismatchIssue formatMismatchIssue) throws E;
	public abstract T visit(DiscardedNotationBreakIssue discardedNotationBreakIssue) throws E;
	public abstract T visit(IgnoredFormatIssue ignoredFormatIssue) throws E;
	public abstract T visit(NonInjectiveInterpretationIssue nonInjectiveInterpretationIssue) throws E;
	public abstract T visit(OpaqueInterpretationIssue opaqueInterpretationIssue) throws E;
	public abstract T visit(VariableBoundNotationIssue variableBoundNotationIssue) throws E;
	public abstract T visit(UnusedInterpretationIssue unusedInterpretationIssue) throws E;
	public abstract T visit(IncompatibleLevelRedeclarationIssue incompatibleLevelRedeclarationIssue) throws E;
	public abstract T visit(IncompatibleFormatRedeclarationIssue incompatibleFormatRedeclarationIssue) throws E;
	public abstract T visit(NoSyntaxRuleIssue noSyntaxRuleIssue) throws E;
	public abstract T visit(LevelAssociativityIssue levelAssociativityIssue) throws E;
	public abstract T visit(UnknownCustomEntryIssue unknownCustomEntryIssue) throws E;
	public abstract T visit(CustomEntryExistsIssue customEntryExistsIssue) throws E;
	public abstract T visit(UndeclaredScopeIssue undeclaredScopeIssue) throws E;
	public abstract T visit(ScopeDelimiterIssue scopeDelimiterIssue) throws E;
	public abstract T visit(CurlyBracketsIssue curlyBracketsIssue) throws E;
}
