package notasyn.lexer;

/**
 * The lexer's table of reserved words. Words registered here are no longer lexed as identifiers.
 */
public interface KeywordTable {

	void register(String word);

	boolean isKeyword(String word);

}
