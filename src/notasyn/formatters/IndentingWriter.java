package notasyn.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that starts every line after the first at the current indentation, and keeps track
 * of the column it writes at. The issue messages and the state dump are written through it.
 */
public class IndentingWriter extends Writer {

	private final Writer out;
	private final int step;
	private final String lineSeparator;

	private int margin = 0;
	private int column = 0;
	private boolean atLineStart = false;

	/**
	 * Undoes one {@link #indent(int)} when closed.
	 */
	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private final int spaces;

		public Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}
	}

	public IndentingWriter(Writer out) {
		this(out, 4);
	}

	public IndentingWriter(Writer out, int step) {
		this(out, step, System.lineSeparator());
	}

	public IndentingWriter(Writer out, int step, String lineSeparator) {
		this.out = out;
		this.step = step;
		this.lineSeparator = lineSeparator;
	}

	public Indent indent(int spaces) {
		margin += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(step);
	}

	/**
	 * Lines written before the returned {@link Indent} is closed start below the current column.
	 */
	public Indent indentToPosition() {
		return indentToPosition(column);
	}

	public Indent indentToPosition(int position) {
		return indent(position - margin);
	}

	public void unindent(int spaces) {
		if (spaces > margin) {
			throw new IllegalStateException("cannot unindent " + spaces + " spaces from a margin of " + margin);
		}
		margin -= spaces;
	}

	/**
	 * @return the 0-based column the next character goes to
	 */
	public int getHorizontalPosition() {
		return column;
	}

	public int getIndent() {
		return margin;
	}

	public void newLine() throws IOException {
		write(lineSeparator);
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String text = String.valueOf(chars, offset, len);
		int from = 0;
		while (from < text.length()) {
			if (atLineStart) {
				writeMargin();
			}
			int end = text.indexOf(lineSeparator, from);
			if (end == -1) {
				out.write(text, from, text.length() - from);
				column += text.length() - from;
				return;
			}
			end += lineSeparator.length();
			out.write(text, from, end - from);
			column = 0;
			atLineStart = true;
			from = end;
		}
	}

	private void writeMargin() throws IOException {
		for (int i = 0; i < margin; i++) {
			out.write(' ');
		}
		column = margin;
		atLineStart = false;
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void close() throws IOException {
		out.close();
	}
}
