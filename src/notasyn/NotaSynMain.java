package notasyn;

import notasyn.errors.TopLevelIssueContext;
import notasyn.formatters.GrammarStateFormatter;
import notasyn.formatters.IndentingWriter;
import notasyn.model.command.Command;
import notasyn.printer.NotationPrinter;
import notasyn.state.GrammarState;
import notasyn.trans.CommandRegistrationVisitor;
import notasyn.trans.NotaSynTransException;
import notasyn.trans.NotationRegistrar;
import notasyn.trans.NotationRegistrationException;
import notasyn.trans.passes.parse.declaration.DeclarationParsingPass;
import notasyn.trans.passes.parse.option.OptionParsingPass;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class NotaSynMain {
	// parent of every notasyn.* logger, so that -q and -v apply to all of them
	private static final Logger logger = Logger.getLogger("notasyn");

	private String[] cmdArgs;

	public NotaSynMain(String[] args) {
		cmdArgs = args;
	}

	public static void main(String[] args) {
		try (InputStream config = NotaSynMain.class.getResourceAsStream("/logging.properties")) {
			if (config != null) {
				LogManager.getLogManager().readConfiguration(config);
			}
		} catch (IOException e) {
			System.err.println("unable to read the logging configuration: " + e.getMessage());
		}
		if (new NotaSynMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	// Top-level workhorse method.
	public boolean run() {
		try {
			TopLevelIssueContext ctx = new TopLevelIssueContext();

			// Check options, set up logging.
			NotaSynOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
			if (ctx.hasErrors()) {
				System.err.println(ctx.format());
				opts.printHelp();
				return false;
			}
			if (opts.version) {
				System.out.println("NotaSyn version " + NotaSynOptions.VERSION);
				return true;
			}
			if (opts.help) {
				opts.printHelp();
				return true;
			}

			logger.info("Reading declarations from \"" + opts.declarationFilePath + "\"");
			List<Command> commands = DeclarationParsingPass.perform(ctx, new File(opts.declarationFilePath));
			checkErrors(ctx);

			GrammarState state = new GrammarState();
			boolean ok = register(new NotationRegistrar(state), commands);

			logger.info("Writing registered rules");
			Writer writer = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
			IndentingWriter out = new IndentingWriter(writer);
			GrammarStateFormatter.format(out, state, new NotationPrinter(opts.width));
			out.flush();
			return ok;
		} catch (NotaSynTransException | IOException e) {
			logger.severe(e.getMessage());
			return false;
		}
	}

	/**
	 * Registers the commands in order, stopping at the first one that fails. The commands before it
	 * stay registered.
	 */
	static boolean register(NotationRegistrar registrar, List<Command> commands) {
		logger.info("Registering " + commands.size() + " declaration(s)");
		CommandRegistrationVisitor visitor = new CommandRegistrationVisitor(registrar);
		for (Command command : commands) {
			try {
				command.accept(visitor);
			} catch (NotationRegistrationException e) {
				logger.severe(e.getMessage());
				return false;
			}
		}
		return true;
	}

	private static void checkErrors(TopLevelIssueContext ctx) throws NotaSynTransException {
		if (ctx.hasErrors()) {
			throw new NotaSynTransException(ctx.format());
		}
	}
}
