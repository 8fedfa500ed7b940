package notasyn;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class NotaSynOptionsTest {

	@Test
	public void declarationFileAndWidth() throws NotaSynOptionException {
		NotaSynOptions opts = new NotaSynOptions(new String[] {"-c", "decls.json", "-w", "40"});
		opts.parse();
		assertThat(opts.declarationFilePath, is("decls.json"));
		assertThat(opts.width, is(40));
		assertFalse(opts.logLvlQuiet);
		assertFalse(opts.logLvlVerbose);
	}

	@Test
	public void defaultWidth() throws NotaSynOptionException {
		NotaSynOptions opts = new NotaSynOptions(new String[] {"-c", "decls.json", "-v"});
		opts.parse();
		assertThat(opts.width, is(80));
		assertTrue(opts.logLvlVerbose);
	}

	@Test
	public void helpNeedsNothingElse() throws NotaSynOptionException {
		NotaSynOptions opts = new NotaSynOptions(new String[] {"-h"});
		opts.parse();
		assertTrue(opts.help);
	}

	@Test(expected = NotaSynOptionException.class)
	public void declarationFileIsRequired() throws NotaSynOptionException {
		new NotaSynOptions(new String[] {"-q"}).parse();
	}

	@Test(expected = NotaSynOptionException.class)
	public void widthMustBePositive() throws NotaSynOptionException {
		new NotaSynOptions(new String[] {"-c", "decls.json", "-w", "0"}).parse();
	}

	@Test(expected = NotaSynOptionException.class)
	public void unexpectedArgument() throws NotaSynOptionException {
		new NotaSynOptions(new String[] {"-c", "decls.json", "extra.json"}).parse();
	}

	@Test(expected = NotaSynOptionException.class)
	public void unknownOption() throws NotaSynOptionException {
		new NotaSynOptions(new String[] {"-c", "decls.json", "--frobnicate"}).parse();
	}
}
