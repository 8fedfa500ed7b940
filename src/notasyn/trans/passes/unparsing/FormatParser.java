package notasyn.trans.passes.unparsing;

import notasyn.errors.IssueContext;
import notasyn.model.notation.NotationTokens;
import notasyn.model.unparsing.UnparsingBox;
import notasyn.model.unparsing.UnparsingCut;
import notasyn.util.SourceLocation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reads a format string. Items are separated by single blanks; any extra blank before an item is
 * printed as is, unless the item is a cut, in which case it gives the width of the cut.
 *
 * <pre>
 *   /n          a breakable cut, indenting by n when it breaks
 *   //          a forced line break
 *   [ ... ]     an hov box, [hv n ... ] and [v n ... ] the other kinds of boxes
 *   'text'      a literal
 *   ..          the ellipsis of a recursive pattern
 * </pre>
 *
 * Unquoted identifiers refer to notation variables; other unquoted items must be single characters.
 */
public class FormatParser {

	private static class OpenBox {
		final UnparsingBox.Kind kind;
		final int indent;
		final SourceLocation location;
		final List<FormatItem> children = new ArrayList<>();

		OpenBox(UnparsingBox.Kind kind, int indent, SourceLocation location) {
			this.kind = kind;
			this.indent = indent;
			this.location = location;
		}
	}

	private final IssueContext ctx;
	private final String format;
	private final Deque<OpenBox> boxes;
	private int pos;

	private FormatParser(IssueContext ctx, String format) {
		this.ctx = ctx;
		this.format = format;
		this.boxes = new ArrayDeque<>();
		this.pos = 0;
	}

	/**
	 * @return the items of the format, or null after reporting an issue
	 */
	public static List<FormatItem> parse(IssueContext ctx, String format) {
		return new FormatParser(ctx, format).parse();
	}

	private SourceLocation location(int start, int end) {
		return new SourceLocation(format, start, end);
	}

	private int skipBlanks() {
		int start = pos;
		while (pos < format.length() && format.charAt(pos) == ' ') {
			pos++;
		}
		return pos - start;
	}

	private String readToken() {
		int start = pos;
		while (pos < format.length() && format.charAt(pos) != ' ') {
			pos++;
		}
		return format.substring(start, pos);
	}

	private static boolean isDigits(String s) {
		for (int i = 0; i < s.length(); i++) {
			if (!Character.isDigit(s.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return the indentation, or null after reporting that it is out of range
	 */
	private Integer readIndent(String digits, SourceLocation location) {
		try {
			return Integer.parseInt(digits);
		} catch (NumberFormatException e) {
			ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.INVALID_INDENT, location));
			return null;
		}
	}

	private List<FormatItem> parse() {
		OpenBox root = new OpenBox(UnparsingBox.Kind.HOV, 0, SourceLocation.wholeOf(format));
		boxes.push(root);
		boolean atStart = true;
		while (true) {
			int blankStart = pos;
			int blanks = skipBlanks();
			if (pos == format.length()) {
				if (blanks > 0) {
					ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.TRAILING_SPACES,
							location(blankStart, pos)));
					return null;
				}
				break;
			}
			int rigid = atStart ? blanks : blanks - 1;
			atStart = false;
			int start = pos;
			String token = readToken();
			SourceLocation tokenLocation = location(start, pos);

			if (token.equals("//")) {
				current().add(new FormatItem.Cut(location(blankStart, pos), UnparsingCut.forcedNewline()));
				continue;
			}
			if (token.startsWith("/") && isDigits(token.substring(1))) {
				Integer indent = token.length() == 1 ? Integer.valueOf(0) : readIndent(token.substring(1), tokenLocation);
				if (indent == null) {
					return null;
				}
				current().add(new FormatItem.Cut(location(blankStart, pos), UnparsingCut.breakable(rigid, indent)));
				continue;
			}
			if (rigid > 0) {
				current().add(new FormatItem.Text(location(start - rigid, start), repeat(' ', rigid), false));
			}
			if (!parseItem(token, tokenLocation)) {
				return null;
			}
		}
		if (boxes.size() > 1) {
			ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.UNTERMINATED_BOX, boxes.peek().location));
			return null;
		}
		return root.children;
	}

	private List<FormatItem> current() {
		return boxes.peek().children;
	}

	private boolean parseItem(String token, SourceLocation tokenLocation) {
		switch (token) {
			case "[":
				boxes.push(new OpenBox(UnparsingBox.Kind.HOV, 0, tokenLocation));
				return true;
			case "[hv":
				return openIndentedBox(UnparsingBox.Kind.HV, tokenLocation);
			case "[v":
				return openIndentedBox(UnparsingBox.Kind.V, tokenLocation);
			case "]":
				if (boxes.size() == 1) {
					ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.UNOPENED_BOX, tokenLocation));
					return false;
				}
				OpenBox box = boxes.pop();
				current().add(new FormatItem.Box(box.location.combine(tokenLocation), box.kind, box.indent, box.children));
				return true;
			case "..":
				current().add(new FormatItem.Ellipsis(tokenLocation));
				return true;
			default:
				break;
		}
		if (token.startsWith("'")) {
			return parseQuoted(token, tokenLocation);
		}
		if (NotationTokens.isIdent(token) || token.length() == 1) {
			current().add(new FormatItem.Text(tokenLocation, token, false));
			return true;
		}
		ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.UNQUOTED_TOKEN, tokenLocation));
		return false;
	}

	private boolean openIndentedBox(UnparsingBox.Kind kind, SourceLocation opener) {
		skipBlanks();
		int start = pos;
		String indent = readToken();
		if (indent.isEmpty() || !isDigits(indent)) {
			pos = start;
			ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.MISSING_BOX_INDENT, opener));
			return false;
		}
		SourceLocation indentLocation = location(start, pos);
		Integer value = readIndent(indent, indentLocation);
		if (value == null) {
			return false;
		}
		boxes.push(new OpenBox(kind, value, opener.combine(indentLocation)));
		return true;
	}

	/**
	 * A quoted literal ends with the first quote followed by a blank or by the end of the format.
	 */
	private boolean parseQuoted(String token, SourceLocation tokenLocation) {
		if (token.length() == 1) {
			ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.LONE_QUOTE, tokenLocation));
			return false;
		}
		if (token.endsWith("'")) {
			if (token.length() == 2) {
				ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.EMPTY_QUOTED_TOKEN, tokenLocation));
				return false;
			}
			current().add(new FormatItem.Text(tokenLocation, token.substring(1, token.length() - 1), true));
			return true;
		}
		if (closingQuoteFollows(pos)) {
			ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.SPACE_IN_QUOTE, location(pos, pos + 1)));
		} else {
			ctx.error(new FormatMismatchIssue(FormatMismatchIssue.Reason.UNCLOSED_QUOTE, tokenLocation));
		}
		return false;
	}

	private boolean closingQuoteFollows(int from) {
		for (int i = from; i < format.length(); i++) {
			if (format.charAt(i) == '\'' && (i + 1 == format.length() || format.charAt(i + 1) == ' ')) {
				return true;
			}
		}
		return false;
	}

	private static String repeat(char c, int n) {
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < n; i++) {
			builder.append(c);
		}
		return builder.toString();
	}
}
