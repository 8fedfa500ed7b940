package notasyn.trans.passes.precedence;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import notasyn.errors.TopLevelIssueContext;
import notasyn.model.notation.*;
import notasyn.trans.passes.decompose.NotationDecompositionPass;

public class AssociativityRecomputationTest {

	private static EntryType border(BorderSide side, Associativity associativity) {
		return new SubExpressionEntryType(NotationEntry.constr(), ProductionLevel.numeric(50),
				ProductionPosition.border(side, associativity));
	}

	private static DecomposedNotation plus(TopLevelIssueContext ctx) {
		return NotationDecompositionPass.perform(ctx, "x + y", NotationEntry.constr(), false);
	}

	@Test
	public void leftTagOnTheLeft() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<EntryType> types = Arrays.asList(border(BorderSide.LEFT, Associativity.LEFT),
				border(BorderSide.RIGHT, Associativity.LEFT));
		assertThat(PrecedenceResolutionPass.recomputeAssociativity(ctx, plus(ctx), types), is(Associativity.LEFT));
		assertFalse(ctx.hasErrors());
	}

	@Test
	public void rightTagOnTheRight() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<EntryType> types = Arrays.asList(border(BorderSide.LEFT, Associativity.RIGHT),
				border(BorderSide.RIGHT, Associativity.RIGHT));
		assertThat(PrecedenceResolutionPass.recomputeAssociativity(ctx, plus(ctx), types), is(Associativity.RIGHT));
	}

	@Test
	public void noTags() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<EntryType> types = Arrays.asList((EntryType) new IdentEntryType(), border(BorderSide.RIGHT, Associativity.NON));
		assertNull(PrecedenceResolutionPass.recomputeAssociativity(ctx, plus(ctx), types));
		assertNull(PrecedenceResolutionPass.recomputeAssociativity(ctx, plus(ctx), Collections.<EntryType>emptyList()));
		assertFalse(ctx.hasErrors());
	}

	@Test
	public void leftAndRightTogether() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<EntryType> types = Arrays.asList(border(BorderSide.LEFT, Associativity.LEFT),
				border(BorderSide.RIGHT, Associativity.RIGHT));
		assertNull(PrecedenceResolutionPass.recomputeAssociativity(ctx, plus(ctx), types));
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.getIssues().get(0), instanceOf(ContradictoryAssociativityIssue.class));
	}
}
