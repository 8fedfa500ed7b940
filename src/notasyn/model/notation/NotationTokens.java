package notasyn.model.notation;

import java.util.regex.Pattern;

/**
 * Lexical classification of the tokens found in notation patterns.
 */
public final class NotationTokens {

	private static final Pattern UNSIGNED_NUMERAL = Pattern.compile(
			"[0-9][0-9_]*(\\.[0-9_]+)?([eE][+-]?[0-9][0-9_]*)?");

	private NotationTokens() {}

	public static boolean isIdentStart(char c) {
		return Character.isLetter(c) || c == '_';
	}

	public static boolean isIdentPart(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '\'';
	}

	/**
	 * @return whether the token is identifier-shaped; `_` alone is not an identifier
	 */
	public static boolean isIdent(String token) {
		if (token.isEmpty() || token.equals("_") || !isIdentStart(token.charAt(0))) {
			return false;
		}
		for (int i = 1; i < token.length(); i++) {
			if (!isIdentPart(token.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	public static boolean isUnsignedNumeral(String token) {
		return UNSIGNED_NUMERAL.matcher(token).matches();
	}

	/**
	 * Quotes a terminal the way it appears in a notation key: identifier-shaped terminals, and
	 * terminals that themselves start with a quote, are wrapped in single quotes.
	 */
	public static String quote(String terminal) {
		if (isIdent(terminal) || (terminal.length() > 2 && terminal.charAt(0) == '\'')) {
			return "'" + terminal + "'";
		}
		return terminal;
	}

	public static boolean isComma(String token) {
		return token.startsWith(",") || token.startsWith(";");
	}

	public static boolean isOperator(String token) {
		if (token.isEmpty()) {
			return false;
		}
		switch (token.charAt(0)) {
			case '+':
			case '*':
			case '=':
			case '-':
			case '/':
			case '<':
			case '>':
			case '@':
			case '\\':
			case '&':
			case '~':
			case '$':
				return true;
			default:
				return false;
		}
	}

	public static boolean isLeftBracket(String token) {
		return !token.isEmpty() && "{[(".indexOf(token.charAt(0)) >= 0
				&& "}])".indexOf(token.charAt(token.length() - 1)) < 0;
	}

	public static boolean isRightBracket(String token) {
		return !token.isEmpty() && "}])".indexOf(token.charAt(token.length() - 1)) >= 0
				&& "{[(".indexOf(token.charAt(0)) < 0;
	}
}
