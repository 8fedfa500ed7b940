package notasyn.trans.passes.parse.option;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.logging.Level;
import java.util.logging.Logger;

import org.junit.Test;

import notasyn.NotaSynOptions;
import notasyn.errors.TopLevelIssueContext;

public class OptionParsingPassTest {

	private final Logger logger = Logger.getLogger("notasyn.test.options");

	@Test
	public void quietLowersTheLogLevel() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		NotaSynOptions opts = OptionParsingPass.perform(ctx, logger, new String[] {"-q", "-c", "decls.json"});
		assertFalse(ctx.hasErrors());
		assertTrue(opts.logLvlQuiet);
		assertThat(logger.getLevel(), is(Level.WARNING));
	}

	@Test
	public void verboseRaisesTheLogLevel() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		OptionParsingPass.perform(ctx, logger, new String[] {"-v", "-c", "decls.json"});
		assertThat(logger.getLevel(), is(Level.FINE));
	}

	@Test
	public void invalidOptionsAreReported() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		OptionParsingPass.perform(ctx, logger, new String[0]);
		assertTrue(ctx.hasErrors());
		assertThat(ctx.getIssues().get(0), instanceOf(OptionParserIssue.class));
		assertThat(ctx.getIssues().get(0).getMessage(), containsString("declaration file is required"));
		assertThat(logger.getLevel(), is(Level.INFO));
	}
}
