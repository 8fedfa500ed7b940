package notasyn.lexer;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

public class TokenTable implements KeywordTable {

	private final Set<String> keywords;

	public TokenTable() {
		this.keywords = new TreeSet<>();
	}

	private TokenTable(Set<String> keywords) {
		this.keywords = new TreeSet<>(keywords);
	}

	@Override
	public void register(String word) {
		keywords.add(word);
	}

	@Override
	public boolean isKeyword(String word) {
		return keywords.contains(word);
	}

	public Set<String> getKeywords() {
		return Collections.unmodifiableSet(keywords);
	}

	public TokenTable copy() {
		return new TokenTable(keywords);
	}
}
