package notasyn.grammar;

import notasyn.model.grammar.Production;
import notasyn.model.notation.Associativity;
import notasyn.model.notation.NotationEntry;

/**
 * The parser generator the synthesized productions are installed into. Entries are split into
 * numbered levels, each with its own associativity.
 */
public interface GrammarEngine {

	/**
	 * @return the entry known under that grammar name, or null if there is none
	 */
	GrammarEntry lookupEntry(String name);

	void createEntry(NotationEntry entry);

	/**
	 * @return the associativity of an existing level, or null if the entry has no such level yet
	 */
	Associativity getLevelAssociativity(NotationEntry entry, int level);

	/**
	 * Adds a production at a level of an existing entry, creating the level with the given
	 * associativity if needed.
	 */
	void addProduction(NotationEntry entry, int level, Associativity associativity, Production production);

}
