package notasyn.model.notation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The identity of a notation: its entry and the normalized text of its symbols.
 */
public final class NotationKey {

	private final NotationEntry entry;
	private final String text;

	public NotationKey(NotationEntry entry, String text) {
		this.entry = entry;
		this.text = text;
	}

	public static NotationKey of(NotationEntry entry, List<NotationSymbol> symbols) {
		return new NotationKey(entry, String.join(" ", keyTokens(symbols)));
	}

	private static List<String> keyTokens(List<NotationSymbol> symbols) {
		List<String> tokens = new ArrayList<>();
		for (NotationSymbol symbol : symbols) {
			if (symbol instanceof NotationTerminal) {
				tokens.add(NotationTokens.quote(((NotationTerminal) symbol).getText()));
			} else if (symbol instanceof NotationVariable) {
				tokens.add("_");
			} else if (symbol instanceof NotationRecursiveList) {
				List<String> separator = keyTokens(((NotationRecursiveList) symbol).getSeparator());
				tokens.add("_");
				tokens.addAll(separator);
				tokens.add("..");
				tokens.addAll(separator);
				tokens.add("_");
			}
		}
		return tokens;
	}

	public NotationEntry getEntry() {
		return entry;
	}

	public String getText() {
		return text;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		NotationKey other = (NotationKey) o;
		return entry.equals(other.entry) && text.equals(other.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(entry, text);
	}

	@Override
	public String toString() {
		if (entry.isCustom()) {
			return "\"" + text + "\" in " + entry;
		}
		return "\"" + text + "\"";
	}
}
