package notasyn.library;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import notasyn.errors.TopLevelIssueContext;
import notasyn.model.notation.Abbreviation;
import notasyn.model.notation.NotationEntry;
import notasyn.model.notation.NotationInterpretation;
import notasyn.model.notation.NotationKey;
import notasyn.model.notation.NotationUse;
import notasyn.model.term.NotationTerm;
import notasyn.state.GrammarState;

import static notasyn.model.term.TermBuilder.*;

public class LibraryTest {

	private static class RecordingObject implements LibraryObject<String> {
		private final List<String> calls = new ArrayList<>();

		@Override
		public String getName() {
			return "RECORDING";
		}

		@Override
		public void declare(String artifact) {
			calls.add("declare " + artifact);
		}

		@Override
		public void cache(String artifact) {
			calls.add("cache " + artifact);
		}

		@Override
		public void open(int phase, String artifact) {
			calls.add("open " + phase + " " + artifact);
		}

		@Override
		public String substitute(Substitution substitution, String artifact) {
			calls.add("substitute " + artifact);
			return substitution.apply(artifact);
		}

		@Override
		public Classification classify(String artifact) {
			calls.add("classify " + artifact);
			return artifact.startsWith("local") ? Classification.DISPOSE : Classification.KEEP;
		}
	}

	@Test
	public void callbacksRunInOrder() {
		Library library = new Library();
		RecordingObject object = new RecordingObject();
		assertTrue(library.addLeaf(object, "nat"));
		assertThat(object.calls, is(Arrays.asList(
				"declare nat", "cache nat", "open 1 nat", "substitute nat", "classify nat")));
		assertThat(library.getLeaves().size(), is(1));
		assertThat(library.getLeaves().get(0).getArtifact(), is("nat"));
		assertThat(library.getLeaves().get(0).toString(), is("RECORDING nat"));
	}

	@Test
	public void disposedObjectsAreNotKept() {
		Library library = new Library();
		assertFalse(library.addLeaf(new RecordingObject(), "local_nat"));
		assertTrue(library.getLeaves().isEmpty());
	}

	@Test
	public void copyIsIndependent() {
		Library library = new Library();
		library.addLeaf(new RecordingObject(), "a");
		Library copy = library.copy();
		library.addLeaf(new RecordingObject(), "b");
		assertThat(copy.getLeaves().size(), is(1));
		assertThat(library.getLeaves().size(), is(2));
	}

	@Test
	public void scopeDeclaration() {
		GrammarState state = new GrammarState();
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertTrue(state.getLibrary().addLeaf(new ScopeCommandObject(state, ctx),
				ScopeCommandObject.Declaration.declare(false, "nat_scope")));
		assertTrue(state.getScopes().isDeclared("nat_scope"));
		assertFalse(state.getLibrary().addLeaf(new ScopeCommandObject(state, ctx),
				ScopeCommandObject.Declaration.declare(true, "local_scope")));
		assertTrue(state.getScopes().isDeclared("local_scope"));
		assertTrue(ctx.getWarnings().isEmpty());
	}

	@Test
	public void classBindingsAreSubstituted() {
		GrammarState state = new GrammarState();
		ScopeCommandObject object = new ScopeCommandObject(state, new TopLevelIssueContext());
		ScopeCommandObject.Declaration binding = ScopeCommandObject.Declaration.bindClasses(false, "nat_scope",
				Collections.singletonList("nat"));
		ScopeCommandObject.Declaration renamed = object.substitute(
				Substitution.of(Collections.singletonMap("nat", "Nat.t")), binding);
		assertThat(renamed.getClasses(), is(Collections.singletonList("Nat.t")));
		object.open(1, renamed);
		assertThat(state.getScopes().getClassScope("Nat.t"), is("nat_scope"));
	}

	@Test
	public void abbreviationBodiesAreSubstituted() {
		GrammarState state = new GrammarState();
		AbbreviationObject object = new AbbreviationObject(state);
		Abbreviation twice = new Abbreviation("twice", Collections.singletonList("n"),
				app(ref("plus"), var("n"), var("n")), false, null, false);
		Abbreviation renamed = object.substitute(Substitution.of(Collections.singletonMap("plus", "Nat.add")), twice);
		assertThat(renamed.getBody(), is((NotationTerm) app(ref("Nat.add"), var("n"), var("n"))));
		assertTrue(state.getLibrary().addLeaf(object, renamed));
		assertThat(state.getNotations().getAbbreviation("twice"), is(renamed));
	}

	@Test
	public void customEntryIsCreatedOnce() {
		GrammarState state = new GrammarState();
		CustomEntryObject object = new CustomEntryObject(state);
		state.getLibrary().addLeaf(object, new CustomEntryObject.Declaration(false, "expr"));
		object.open(1, new CustomEntryObject.Declaration(false, "expr"));
		assertNotNull(state.getGrammar().lookupEntry("custom:expr"));
		assertThat(state.getGrammar().getEntries().size(), is(2));
	}

	@Test
	public void substitutionRenamesReferences() {
		GrammarState state = new GrammarState();
		NotationObject object = new NotationObject(state, new TopLevelIssueContext());
		NotationInterpretation interpretation = new NotationInterpretation(
				new NotationKey(NotationEntry.constr(), "_ + _"), "x + y", null, NotationUse.PARSING_AND_PRINTING,
				app(ref("plus"), var("x"), app("succ", var("y"))), null, null, false);

		assertSame(interpretation, object.substitute(Substitution.identity(), interpretation));
		NotationInterpretation renamed = object.substitute(
				Substitution.of(Collections.singletonMap("plus", "Nat.add")), interpretation);
		assertThat(renamed.getTerm(), is((NotationTerm) app(ref("Nat.add"), var("x"), app("succ", var("y")))));
		assertThat(renamed.getKey(), is(interpretation.getKey()));
	}
}
