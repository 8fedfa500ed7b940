package notasyn.trans.passes.parse.option;

import notasyn.NotaSynOptionException;
import notasyn.NotaSynOptions;
import notasyn.errors.IssueContext;

import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static NotaSynOptions perform(IssueContext ctx, Logger logger, String[] args) {
		NotaSynOptions opts = new NotaSynOptions(args);
		try {
			opts.parse();
		} catch (NotaSynOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
		}
		// set the logger's log level based on command line arguments
		if (opts.logLvlQuiet) {
			logger.setLevel(Level.WARNING);
		} else if (opts.logLvlVerbose) {
			logger.setLevel(Level.FINE);
		} else {
			logger.setLevel(Level.INFO);
		}
		return opts;
	}
}
