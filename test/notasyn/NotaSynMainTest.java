package notasyn;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.File;
import java.net.URISyntaxException;
import java.util.List;

import org.junit.Test;

import notasyn.errors.TopLevelIssueContext;
import notasyn.model.command.Command;
import notasyn.model.notation.NotationEntry;
import notasyn.model.notation.NotationKey;
import notasyn.state.GrammarState;
import notasyn.trans.NotationRegistrar;
import notasyn.trans.passes.parse.declaration.DeclarationParsingPass;

public class NotaSynMainTest {

	private static List<Command> load(String name) throws URISyntaxException {
		File file = new File(NotaSynMainTest.class.getResource("/declarations/" + name).toURI());
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<Command> commands = DeclarationParsingPass.perform(ctx, file);
		assertFalse(ctx.format(), ctx.hasErrors());
		return commands;
	}

	@Test
	public void registersEveryDeclaration() throws URISyntaxException {
		GrammarState state = new GrammarState();
		assertTrue(NotaSynMain.register(new NotationRegistrar(state), load("arith.json")));
		NotationKey plus = new NotationKey(NotationEntry.constr(), "_ + _");
		assertThat(state.getNotations().getLevel(plus).getLevel(), is(50));
		assertThat(state.getNotations().getLevel(new NotationKey(NotationEntry.constr(), "_ * _")).getLevel(), is(40));
		assertTrue(state.getTokens().isKeyword("IF"));
		assertTrue(state.getScopes().getScopes().contains("nat_scope"));
	}

	@Test
	public void stopsAtTheFirstFailure() throws URISyntaxException {
		GrammarState state = new GrammarState();
		assertFalse(NotaSynMain.register(new NotationRegistrar(state), load("conflict.json")));
		NotationKey plus = new NotationKey(NotationEntry.constr(), "_ + _");
		assertThat(state.getNotations().getLevel(plus).getLevel(), is(50));
		assertThat(state.getNotations().getInterpretations(plus).size(), is(1));
		assertNull(state.getNotations().getLevel(new NotationKey(NotationEntry.constr(), "_ * _")));
	}
}
