package notasyn.state;

import notasyn.grammar.InMemoryGrammarEngine;
import notasyn.lexer.TokenTable;
import notasyn.library.Library;

import java.util.logging.Logger;

/**
 * All the tables a notation registration may change: keywords, grammar, notations, scopes and
 * the library log. Registrations run inside {@link #protect()}, so that a failing one leaves the
 * tables as they were.
 */
public class GrammarState {

	private static final Logger logger = Logger.getLogger("notasyn.state");

	/**
	 * A deep copy of the tables, taken before a registration.
	 */
	public static final class Snapshot {
		private final TokenTable tokens;
		private final InMemoryGrammarEngine grammar;
		private final NotationRegistry notations;
		private final ScopeTable scopes;
		private final Library library;

		private Snapshot(TokenTable tokens, InMemoryGrammarEngine grammar, NotationRegistry notations,
						 ScopeTable scopes, Library library) {
			this.tokens = tokens;
			this.grammar = grammar;
			this.notations = notations;
			this.scopes = scopes;
			this.library = library;
		}
	}

	private TokenTable tokens;
	private InMemoryGrammarEngine grammar;
	private NotationRegistry notations;
	private ScopeTable scopes;
	private Library library;

	public GrammarState() {
		this.tokens = new TokenTable();
		this.grammar = new InMemoryGrammarEngine();
		this.notations = new NotationRegistry();
		this.scopes = new ScopeTable();
		this.library = new Library();
	}

	public TokenTable getTokens() {
		return tokens;
	}

	public InMemoryGrammarEngine getGrammar() {
		return grammar;
	}

	public NotationRegistry getNotations() {
		return notations;
	}

	public ScopeTable getScopes() {
		return scopes;
	}

	public Library getLibrary() {
		return library;
	}

	public Snapshot snapshot() {
		return new Snapshot(tokens.copy(), grammar.copy(), notations.copy(), scopes.copy(), library.copy());
	}

	/**
	 * Puts back the tables of the snapshot. The snapshot is copied again, so it may be restored
	 * more than once.
	 */
	public void restore(Snapshot snapshot) {
		logger.fine("Restoring grammar state");
		this.tokens = snapshot.tokens.copy();
		this.grammar = snapshot.grammar.copy();
		this.notations = snapshot.notations.copy();
		this.scopes = snapshot.scopes.copy();
		this.library = snapshot.library.copy();
	}

	/**
	 * Takes a snapshot, restored when the returned protection is closed unless it was committed:
	 *
	 * <pre>
	 * try (StateProtection protection = state.protect()) {
	 *     ...
	 *     protection.commit();
	 * }
	 * </pre>
	 */
	public StateProtection protect() {
		return new StateProtection(this, snapshot());
	}
}
