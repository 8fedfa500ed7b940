package notasyn.formatters;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringWriter;

import org.junit.Test;

public class IndentingWriterTest {

	@Test
	public void indentsFollowingLines() throws IOException {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw, 2, "\n");
		out.write("a");
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			out.write("b\nc");
			assertThat(out.getHorizontalPosition(), is(3));
		}
		out.newLine();
		out.write("d");
		assertThat(sw.toString(), is("a\n  b\n  c\nd"));
	}

	@Test
	public void indentsToTheCurrentColumn() throws IOException {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw, 2, "\n");
		out.write("renders as: ");
		try (IndentingWriter.Indent ignored = out.indentToPosition()) {
			assertThat(out.getIndent(), is(12));
			out.write("x +\ny");
		}
		assertThat(out.getIndent(), is(0));
		assertThat(sw.toString(), is("renders as: x +\n            y"));
	}

	@Test(expected = IllegalStateException.class)
	public void cannotUnindentBelowZero() {
		new IndentingWriter(new StringWriter()).unindent(1);
	}
}
