package notasyn.state;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Collections;

import org.junit.Test;

import notasyn.model.notation.Level;
import notasyn.model.notation.NotationEntry;
import notasyn.model.notation.NotationKey;

public class GrammarStateTest {

	private static final NotationKey KEY = new NotationKey(NotationEntry.constr(), "_ + _");

	private static void change(GrammarState state) {
		state.getTokens().register("+");
		state.getScopes().declareScope("nat_scope");
		state.getNotations().declareLevel(KEY, new Level(NotationEntry.constr(), 50, Collections.emptyList()),
				Collections.emptyList());
		state.getGrammar().createEntry(NotationEntry.custom("expr"));
	}

	private static void assertPristine(GrammarState state) {
		assertFalse(state.getTokens().isKeyword("+"));
		assertFalse(state.getScopes().isDeclared("nat_scope"));
		assertNull(state.getNotations().getLevel(KEY));
		assertNull(state.getGrammar().lookupEntry("custom:expr"));
		assertNotNull(state.getGrammar().lookupEntry("constr"));
	}

	@Test
	public void restoreUndoesChanges() {
		GrammarState state = new GrammarState();
		GrammarState.Snapshot snapshot = state.snapshot();
		change(state);
		state.restore(snapshot);
		assertPristine(state);

		change(state);
		state.restore(snapshot);
		assertPristine(state);
	}

	@Test
	public void uncommittedProtectionRestores() {
		GrammarState state = new GrammarState();
		try (StateProtection protection = state.protect()) {
			change(state);
			assertFalse(protection.isCommitted());
		}
		assertPristine(state);
	}

	@Test
	public void committedProtectionKeepsChanges() {
		GrammarState state = new GrammarState();
		try (StateProtection protection = state.protect()) {
			change(state);
			protection.commit();
		}
		assertTrue(state.getTokens().isKeyword("+"));
		assertThat(state.getNotations().getLevel(KEY).getLevel(), is(50));
		assertThat(state.getNotations().getKeys(), is(Collections.singleton(KEY)));
	}
}
