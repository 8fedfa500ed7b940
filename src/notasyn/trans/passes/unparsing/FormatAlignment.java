package notasyn.trans.passes.unparsing;

import notasyn.errors.IssueContext;
import notasyn.model.notation.*;
import notasyn.model.unparsing.UnparsingBox;
import notasyn.model.unparsing.UnparsingInstruction;
import notasyn.model.unparsing.UnparsingLiteral;
import notasyn.trans.passes.entry.ResolvedEntryTypes;
import notasyn.util.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks the symbols of a notation and the items of a user format side by side, turning the format
 * into printing instructions. Terminals must be spelled out by the format, variables referred to by
 * name; blanks, cuts and boxes of the format are taken as they are. A recursive list is written in
 * the format as "x sep .. sep y", where both copies of the separator agree.
 */
class FormatAlignment {

	/**
	 * The instructions built for a prefix of the format, and how many symbols they consumed.
	 */
	static class Aligned {
		private final int nextSymbol;
		private final List<UnparsingInstruction> instructions;

		Aligned(int nextSymbol, List<UnparsingInstruction> instructions) {
			this.nextSymbol = nextSymbol;
			this.instructions = instructions;
		}

		int getNextSymbol() {
			return nextSymbol;
		}

		List<UnparsingInstruction> getInstructions() {
			return instructions;
		}
	}

	private static class RecursiveFormat {
		final List<FormatItem> separator;
		final int rest;

		RecursiveFormat(List<FormatItem> separator, int rest) {
			this.separator = separator;
			this.rest = rest;
		}
	}

	private final IssueContext ctx;
	private final ResolvedEntryTypes types;
	private final int notationLevel;

	FormatAlignment(IssueContext ctx, ResolvedEntryTypes types, int notationLevel) {
		this.ctx = ctx;
		this.types = types;
		this.notationLevel = notationLevel;
	}

	/**
	 * @return the instructions for the whole format, or null after reporting an issue
	 */
	List<UnparsingInstruction> alignAll(String format, List<NotationSymbol> symbols, List<FormatItem> items) {
		Aligned aligned = align(symbols, 0, items);
		if (aligned == null) {
			return null;
		}
		if (aligned.getNextSymbol() < symbols.size()) {
			ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.STRUCTURE, SourceLocation.wholeOf(format)));
			return null;
		}
		return aligned.getInstructions();
	}

	/**
	 * Consumes every item, and as many symbols as the items account for.
	 */
	Aligned align(List<NotationSymbol> symbols, int firstSymbol, List<FormatItem> items) {
		List<UnparsingInstruction> instructions = new ArrayList<>();
		int i = firstSymbol;
		int j = 0;
		while (true) {
			NotationSymbol symbol = i < symbols.size() ? symbols.get(i) : null;
			FormatItem item = j < items.size() ? items.get(j) : null;
			if (item == null) {
				return new Aligned(i, instructions);
			}
			if (symbol instanceof NotationTerminal && item instanceof FormatItem.Text
					&& ((FormatItem.Text) item).getText().equals(((NotationTerminal) symbol).getText())) {
				instructions.add(new UnparsingLiteral(((NotationTerminal) symbol).getText()));
				i++;
				j++;
			} else if (item instanceof FormatItem.Text && ((FormatItem.Text) item).isBlank()) {
				instructions.add(new UnparsingLiteral(((FormatItem.Text) item).getText()));
				j++;
			} else if (symbol instanceof NotationVariable && isReferenceTo(item, ((NotationVariable) symbol).getName())) {
				String variable = ((NotationVariable) symbol).getName();
				instructions.add(types.getType(variable).accept(new MetaVariableInstructionVisitor(variable, notationLevel)));
				i++;
				j++;
			} else if (item instanceof FormatItem.Cut) {
				instructions.add(((FormatItem.Cut) item).getCut());
				j++;
			} else if (symbol instanceof NotationRecursiveList && hasEllipsis(items, j)) {
				NotationRecursiveList list = (NotationRecursiveList) symbol;
				RecursiveFormat recursive = readRecursiveFormat(items, j);
				if (recursive == null) {
					return null;
				}
				Aligned separator = align(list.getSeparator(), 0, recursive.separator);
				if (separator == null) {
					return null;
				}
				if (separator.getNextSymbol() < list.getSeparator().size()) {
					ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.STRUCTURE,
							spanOf(recursive.separator, item.getLocation())));
					return null;
				}
				UnparsingInstruction instruction = UnparsingSynthesisPass.listInstruction(
						ctx, list, types.getType(list.getVariable()), notationLevel, separator.getInstructions());
				if (instruction == null) {
					return null;
				}
				instructions.add(instruction);
				i++;
				j = recursive.rest;
			} else if (item instanceof FormatItem.Box) {
				FormatItem.Box box = (FormatItem.Box) item;
				Aligned inner = align(symbols, i, box.getChildren());
				if (inner == null) {
					return null;
				}
				instructions.add(new UnparsingBox(box.getKind(), box.getIndent(), inner.getInstructions()));
				i = inner.getNextSymbol();
				j++;
			} else if (symbol instanceof NotationBreak) {
				ctx.warning(new DiscardedNotationBreakIssue(symbol.getLocation()));
				i++;
			} else {
				ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.STRUCTURE, item.getLocation()));
				return null;
			}
		}
	}

	private static boolean isReferenceTo(FormatItem item, String variable) {
		return item instanceof FormatItem.Text && !((FormatItem.Text) item).isQuoted()
				&& ((FormatItem.Text) item).getText().equals(variable);
	}

	private static boolean hasEllipsis(List<FormatItem> items, int from) {
		for (int k = from; k < items.size(); k++) {
			if (items.get(k) instanceof FormatItem.Ellipsis) {
				return true;
			}
		}
		return false;
	}

	private static SourceLocation spanOf(List<FormatItem> items, SourceLocation fallback) {
		SourceLocation span = SourceLocation.unknown();
		for (FormatItem item : items) {
			span = span.combine(item.getLocation());
		}
		return span.isUnknown() ? fallback : span;
	}

	/**
	 * Splits "x sep .. sep y rest" into the separator and the index of rest.
	 */
	private RecursiveFormat readRecursiveFormat(List<FormatItem> items, int from) {
		if (!isVariableItem(items.get(from))) {
			ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.ELLIPSIS_SIDES, items.get(from).getLocation()));
			return null;
		}
		FormatItem head = items.get(from);
		List<FormatItem> separator = new ArrayList<>();
		int k = from + 1;
		while (k < items.size() && !(items.get(k) instanceof FormatItem.Ellipsis)) {
			FormatItem nested = findNestedEllipsis(items.get(k));
			if (nested != null) {
				ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.ELLIPSIS_DEPTH, nested.getLocation()));
				return null;
			}
			separator.add(items.get(k));
			k++;
		}
		if (k == items.size()) {
			ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.ELLIPSIS_SIDES, head.getLocation()));
			return null;
		}
		SourceLocation ellipsis = items.get(k).getLocation();
		k++;
		for (FormatItem expected : separator) {
			if (k >= items.size() || !items.get(k).sameAs(expected)) {
				ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.ELLIPSIS_SIDES,
						k < items.size() ? items.get(k).getLocation() : ellipsis));
				return null;
			}
			k++;
		}
		if (k >= items.size() || !isVariableItem(items.get(k)) || !sameUpToName(head, items.get(k))) {
			ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.ELLIPSIS_SIDES,
					k < items.size() ? items.get(k).getLocation() : ellipsis));
			return null;
		}
		return new RecursiveFormat(separator, k + 1);
	}

	private static boolean isFormatting(FormatItem item) {
		return item instanceof FormatItem.Cut || (item instanceof FormatItem.Text && ((FormatItem.Text) item).isBlank());
	}

	/**
	 * A variable reference, possibly alone in a box of its own.
	 */
	private static boolean isVariableItem(FormatItem item) {
		if (item instanceof FormatItem.Text) {
			return !((FormatItem.Text) item).isBlank();
		}
		if (item instanceof FormatItem.Box) {
			FormatItem only = null;
			for (FormatItem child : ((FormatItem.Box) item).getChildren()) {
				if (isFormatting(child)) {
					continue;
				}
				if (only != null) {
					return false;
				}
				only = child;
			}
			return only != null && isVariableItem(only);
		}
		return false;
	}

	private static boolean sameUpToName(FormatItem first, FormatItem last) {
		if (first instanceof FormatItem.Text && last instanceof FormatItem.Text) {
			return ((FormatItem.Text) first).isQuoted() == ((FormatItem.Text) last).isQuoted();
		}
		if (first instanceof FormatItem.Box && last instanceof FormatItem.Box) {
			FormatItem.Box a = (FormatItem.Box) first;
			FormatItem.Box b = (FormatItem.Box) last;
			if (a.getKind() != b.getKind() || a.getIndent() != b.getIndent()
					|| a.getChildren().size() != b.getChildren().size()) {
				return false;
			}
			for (int k = 0; k < a.getChildren().size(); k++) {
				FormatItem x = a.getChildren().get(k);
				FormatItem y = b.getChildren().get(k);
				boolean same = isFormatting(x) ? x.sameAs(y) : sameUpToName(x, y);
				if (!same) {
					return false;
				}
			}
			return true;
		}
		return false;
	}

	private static FormatItem findNestedEllipsis(FormatItem item) {
		if (!(item instanceof FormatItem.Box)) {
			return null;
		}
		for (FormatItem child : ((FormatItem.Box) item).getChildren()) {
			if (child instanceof FormatItem.Ellipsis) {
				return child;
			}
			FormatItem nested = findNestedEllipsis(child);
			if (nested != null) {
				return nested;
			}
		}
		return null;
	}
}
