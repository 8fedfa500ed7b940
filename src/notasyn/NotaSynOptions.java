package notasyn;

import org.plumelib.options.Option;
import org.plumelib.options.Options;

public class NotaSynOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = { "-help" })
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = { "-quiet" })
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution ", aliases = { "-verbose" })
	public boolean logLvlVerbose = false;

	@Option(value = "-c path to the JSON file of declarations")
	public String declarationFilePath;

	@Option(value = "-w width of the printed rules", aliases = { "-width" })
	public int width = 80;

	private final Options plumeOptions;
	private final String[] args;

	public NotaSynOptions(String[] args) {
		this.plumeOptions = new Options("notasyn [options] -c declarations.json", this);
		this.args = args;
	}

	public void printHelp() {
		plumeOptions.printUsage();
	}

	/**
	 * Reads the command line into the option fields. Nothing else is required when asking for help
	 * or for the version.
	 */
	public void parse() throws NotaSynOptionException {
		String[] remaining;
		try {
			remaining = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new NotaSynOptionException(e.getMessage());
		}

		if (help || version) {
			return;
		}
		if (remaining.length != 0) {
			throw new NotaSynOptionException("Unexpected argument " + remaining[0]);
		}
		if (declarationFilePath == null || declarationFilePath.isEmpty()) {
			throw new NotaSynOptionException("A declaration file is required");
		}
		if (width <= 0) {
			throw new NotaSynOptionException("The width must be positive, got " + width);
		}
	}
}
