package notasyn.formatters;

import notasyn.errors.IssueVisitor;
import notasyn.errors.IssueWithContext;
import notasyn.model.notation.EntryType;
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
import notasyn.util.SourceLocation;

import java.io.IOException;
import java.util.List;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeLocation(SourceLocation location) throws IOException {
		if (location.isUnknown()) {
			return;
		}
		out.write(" ");
		location.writePretty(out);
	}

	private void writeTypes(List<EntryType> types) throws IOException {
		out.write("(");
		boolean first = true;
		for (EntryType type : types) {
			if (!first) {
				out.write(", ");
			}
			first = false;
			out.write(type.toString());
		}
		out.write(")");
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getDescription());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(DeclarationParsingIssue declarationParsingIssue) throws IOException {
		out.write("invalid declaration: ");
		out.write(declarationParsingIssue.getDescription());
		return null;
	}

	@Override
	public Void visit(DuplicateVariableIssue duplicateVariableIssue) throws IOException {
		out.write("variable ");
		out.write(duplicateVariableIssue.getVariable());
		out.write(" occurs more than once");
		writeLocation(duplicateVariableIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(RecursivePatternIssue recursivePatternIssue) throws IOException {
		switch (recursivePatternIssue.getReason()) {
			case UNQUOTED_UNDERSCORE:
				out.write("'_' must be quoted");
				break;
			case NO_VARIABLE_BEFORE_ELLIPSIS:
				out.write("missing variable before the ellipsis");
				break;
			case ONE_SIDED_TOKEN:
				out.write("token occurring on one side of \"..\" only");
				break;
			case ONE_SIDED_BREAK:
				out.write("format break occurring on one side of \"..\" only");
				break;
			case EXPECTED_RECURSIVE_FORM:
				out.write("expected a recursive pattern of the form \"x sep .. sep y\"");
				break;
		}
		writeLocation(recursivePatternIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(AmbiguousLevelIssue ambiguousLevelIssue) throws IOException {
		switch (ambiguousLevelIssue.getReason()) {
			case LEFT_RECURSIVE:
				out.write("the notation starts with a variable: an explicit level is needed");
				break;
			case LEFTMOST_NEEDS_LEVEL:
				out.write("the level of the leftmost non-terminal cannot be inferred: an explicit level is needed");
				break;
			case ONLY_PRINTING_LEFTMOST:
				out.write("a printing-only notation starting with a sub-expression at an explicit level needs an explicit level");
				break;
			case UNDETERMINED:
				out.write("cannot determine the level: an explicit level is needed");
				break;
		}
		writeLocation(ambiguousLevelIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(InvalidLeftmostFormIssue invalidLeftmostFormIssue) throws IOException {
		out.write("leftmost variable ");
		out.write(invalidLeftmostFormIssue.getVariable());
		switch (invalidLeftmostFormIssue.getReason()) {
			case LEVEL_CANNOT_CHANGE:
				out.write(": the level of the leftmost non-terminal cannot be changed");
				break;
			case ATOMIC_NOT_AT_LEVEL_ZERO:
				out.write(": a notation starting with an atomic expression must be at level 0");
				break;
			case BINDER_OR_PATTERN:
				out.write(": a notation starting with a binder or a pattern cannot be used for parsing");
				break;
		}
		writeLocation(invalidLeftmostFormIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(ContradictoryAssociativityIssue contradictoryAssociativityIssue) throws IOException {
		out.write("the notation is asked to be both left and right associative");
		writeLocation(contradictoryAssociativityIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(UnboundVariableIssue unboundVariableIssue) throws IOException {
		out.write("variable ");
		out.write(unboundVariableIssue.getVariable());
		out.write(" does not occur in the notation");
		writeLocation(unboundVariableIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(ScopeMismatchIssue scopeMismatchIssue) throws IOException {
		out.write("the two ends of the recursive pattern ");
		out.write(scopeMismatchIssue.getPair().toString());
		out.write(" are given different entry types: ");
		out.write(scopeMismatchIssue.getFirstType().toString());
		out.write(" and ");
		out.write(scopeMismatchIssue.getLastType().toString());
		return null;
	}

	@Override
	public Void visit(InvalidSubentryLevelIssue invalidSubentryLevelIssue) throws IOException {
		out.write("variable ");
		out.write(invalidSubentryLevelIssue.getVariable());
		out.write(" of ");
		out.write(invalidSubentryLevelIssue.getVariableEntry().toString());
		out.write(" cannot be \"at next level\" in a notation of ");
		out.write(invalidSubentryLevelIssue.getNotationEntry().toString());
		return null;
	}

	@Override
	public Void visit(ModifierIssue modifierIssue) throws IOException {
		switch (modifierIssue.getReason()) {
			case ENTRY_TYPE_AND_LEVEL:
				out.write("variable ");
				out.write(modifierIssue.getVariable());
				out.write(" is given both an entry type and a level");
				break;
			case ONLY_PARSING_AND_PRINTING:
				out.write("a notation cannot be both only parsing and only printing");
				break;
			case ENTRY_TYPE_IN_INFIX:
				out.write("an infix notation cannot give entry types to its operands");
				break;
		}
		return null;
	}

	@Override
	public Void visit(NonProductiveRuleIssue nonProductiveRuleIssue) throws IOException {
		switch (nonProductiveRuleIssue.getReason()) {
			case NO_SYMBOL:
				out.write("a notation must include at least one symbol");
				break;
			case STARTS_WITH_RECURSIVE_LIST:
				out.write("a recursive notation must start with at least one symbol");
				break;
			case NON_TERMINAL_IN_SEPARATOR:
				out.write("the separator of a recursive pattern cannot contain variables");
				break;
			case OPEN_BINDER_WITH_SEPARATOR:
				out.write("a separator cannot be used with an open binder list");
				break;
			case INVALID_RECURSIVE_COMPONENT:
				out.write("only sub-expressions and binders can be repeated in a recursive pattern");
				break;
		}
		writeLocation(nonProductiveRuleIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(FormatMismatchIssue formatMismatchIssue) throws IOException {
		switch (formatMismatchIssue.getReason()) {
			case UNTERMINATED_BOX:
				out.write("box is not closed");
				break;
			case UNCLOSED_QUOTE:
				out.write("quotation mark is not closed");
				break;
			case EMPTY_QUOTED_TOKEN:
				out.write("empty quoted token");
				break;
			case SPACE_IN_QUOTE:
				out.write("spaces are not allowed in a quoted token");
				break;
			case LONE_QUOTE:
				out.write("lone quotation mark");
				break;
			case TRAILING_SPACES:
				out.write("spaces are not allowed at the end of a format");
				break;
			case UNOPENED_BOX:
				out.write("closing a box that was not opened");
				break;
			case MISSING_BOX_INDENT:
				out.write("a box kind must be followed by its indentation");
				break;
			case INVALID_INDENT:
				out.write("indentation out of range");
				break;
			case UNQUOTED_TOKEN:
				out.write("a token of more than one character that is not an identifier must be quoted");
				break;
			case STRUCTURE:
				out.write("the format does not match the notation");
				break;
			case ELLIPSIS_DEPTH:
				out.write("the ellipsis is not at the same box depth as the variable before it");
				break;
			case ELLIPSIS_SIDES:
				out.write("the format is not the same on both sides of the ellipsis");
				break;
		}
		writeLocation(formatMismatchIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(DiscardedNotationBreakIssue discardedNotationBreakIssue) throws IOException {
		out.write("the format overrides the spacing of the notation, which is discarded");
		writeLocation(discardedNotationBreakIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(IgnoredFormatIssue ignoredFormatIssue) throws IOException {
		out.write("the format of an only parsing notation is ignored");
		writeLocation(ignoredFormatIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(NonInjectiveInterpretationIssue nonInjectiveInterpretationIssue) throws IOException {
		out.write("the interpretation does not mention ");
		out.write(String.join(", ", nonInjectiveInterpretationIssue.getMissingVariables()));
		out.write(": the notation will not be used for printing");
		writeLocation(nonInjectiveInterpretationIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(OpaqueInterpretationIssue opaqueInterpretationIssue) throws IOException {
		out.write("the interpretation contains ");
		out.write(opaqueInterpretationIssue.getDescription());
		out.write(", which cannot be reversed: the notation will not be used for printing");
		writeLocation(opaqueInterpretationIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(VariableBoundNotationIssue variableBoundNotationIssue) throws IOException {
		out.write("the notation is bound to the variable ");
		out.write(variableBoundNotationIssue.getVariable());
		out.write(" and will not be used for printing");
		writeLocation(variableBoundNotationIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(UnusedInterpretationIssue unusedInterpretationIssue) throws IOException {
		if (unusedInterpretationIssue.isWithSyntax()) {
			out.write("the notation is used neither for parsing nor for printing");
		} else {
			out.write("the interpretation is used neither for parsing nor for printing");
		}
		writeLocation(unusedInterpretationIssue.getLocation());
		return null;
	}

	@Override
	public Void visit(IncompatibleLevelRedeclarationIssue incompatibleLevelRedeclarationIssue) throws IOException {
		out.write("notation ");
		out.write(incompatibleLevelRedeclarationIssue.getKey().toString());
		out.write(" is already defined at ");
		out.write(incompatibleLevelRedeclarationIssue.getPreviousLevel().toString());
		out.write(" with entries ");
		writeTypes(incompatibleLevelRedeclarationIssue.getPreviousSubentries());
		out.write(" while it is now required to be at ");
		out.write(incompatibleLevelRedeclarationIssue.getLevel().toString());
		out.write(" with entries ");
		writeTypes(incompatibleLevelRedeclarationIssue.getSubentries());
		return null;
	}

	@Override
	public Void visit(IncompatibleFormatRedeclarationIssue incompatibleFormatRedeclarationIssue) throws IOException {
		out.write("notation ");
		out.write(incompatibleFormatRedeclarationIssue.getKey().toString());
		if (incompatibleFormatRedeclarationIssue.getScope() != null) {
			out.write(" in scope ");
			out.write(incompatibleFormatRedeclarationIssue.getScope());
		}
		out.write(" was already declared with a different printing rule, which is overridden");
		return null;
	}

	@Override
	public Void visit(NoSyntaxRuleIssue noSyntaxRuleIssue) throws IOException {
		out.write("no syntax is declared for notation ");
		out.write(noSyntaxRuleIssue.getKey().toString());
		return null;
	}

	@Override
	public Void visit(LevelAssociativityIssue levelAssociativityIssue) throws IOException {
		out.write("level ");
		out.write(Integer.toString(levelAssociativityIssue.getLevel()));
		out.write(" of ");
		out.write(levelAssociativityIssue.getEntry().toString());
		out.write(" has ");
		out.write(levelAssociativityIssue.getPreviousAssociativity().getDescription());
		out.write(", it cannot be given ");
		out.write(levelAssociativityIssue.getAssociativity().getDescription());
		return null;
	}

	@Override
	public Void visit(UnknownCustomEntryIssue unknownCustomEntryIssue) throws IOException {
		out.write("unknown custom entry ");
		out.write(unknownCustomEntryIssue.getName());
		return null;
	}

	@Override
	public Void visit(CustomEntryExistsIssue customEntryExistsIssue) throws IOException {
		out.write("custom entry ");
		out.write(customEntryExistsIssue.getName());
		out.write(" already exists");
		return null;
	}

	@Override
	public Void visit(UndeclaredScopeIssue undeclaredScopeIssue) throws IOException {
		out.write("scope ");
		out.write(undeclaredScopeIssue.getScope());
		out.write(" was not declared, declaring it");
		return null;
	}

	@Override
	public Void visit(ScopeDelimiterIssue scopeDelimiterIssue) throws IOException {
		switch (scopeDelimiterIssue.getReason()) {
			case OVERWRITTEN_KEY:
				out.write("overwriting delimiting key ");
				out.write(scopeDelimiterIssue.getPrevious());
				out.write(" of scope ");
				out.write(scopeDelimiterIssue.getScope());
				out.write(" with ");
				out.write(scopeDelimiterIssue.getKey());
				break;
			case HIDDEN_BINDING:
				out.write("hiding binding of key ");
				out.write(scopeDelimiterIssue.getKey());
				out.write(" to scope ");
				out.write(scopeDelimiterIssue.getPrevious());
				break;
			case NO_KEY:
				out.write("no delimiting key bound to scope ");
				out.write(scopeDelimiterIssue.getScope());
				break;
		}
		return null;
	}

	@Override
	public Void visit(CurlyBracketsIssue curlyBracketsIssue) throws IOException {
		out.write("notations containing \"{ x }\" need the notation \"{ x }\" with a grammar rule");
		writeLocation(curlyBracketsIssue.getLocation());
		return null;
	}
}
