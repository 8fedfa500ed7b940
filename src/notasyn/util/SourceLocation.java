package notasyn.util;

import notasyn.Unreachable;
import notasyn.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Objects;

/**
 * A span of characters inside a piece of declaration text: a notation pattern or a format string.
 *
 * Offsets are 0-based, the end offset is exclusive. A location whose start equals its end points
 * between two characters (used for "expected something here" errors).
 */
public class SourceLocation implements Comparable<SourceLocation> {
	private String source;
	private int startOffset;
	private int endOffset;
	
	public SourceLocation(String source, int startOffset, int endOffset) {
		this.source = source;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
	}

	public static SourceLocation wholeOf(String source) {
		return new SourceLocation(source, 0, source.length());
	}

	public String prettyString() {
		StringWriter sw = new StringWriter();
		writePretty(new IndentingWriter(sw));
		return sw.getBuffer().toString();
	}

	public void writePretty(IndentingWriter out) {
		try {
			if(isUnknown()) {
				out.write("at unknown source location");
			} else {
				out.write("at ");
				if(startOffset + 1 < endOffset) {
					out.write(""+(startOffset+1)+"-"+endOffset);
				} else {
					out.write(""+(startOffset+1));
				}
				out.write(" in \"");
				out.write(source);
				out.write("\"");
				out.newLine();
				out.write(source);
				out.newLine();
				for(int pos = 0; pos < startOffset; pos++) {
					out.append(' ');
				}
				final int effectiveEndOffset;
				if(startOffset == endOffset) {
					effectiveEndOffset = endOffset + 1;
				} else {
					effectiveEndOffset = endOffset;
				}
				for(int pos = startOffset; pos < effectiveEndOffset; pos++) {
					out.append('^');
				}
				if(startOffset >= source.length()) {
					out.append(" end of text");
				}
			}
		} catch (IOException e) {
			throw new Unreachable(); // string ops shouldn't throw IO exceptions
		}
	}
	
	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1);
	}
	
	public boolean isUnknown() {
		return source == null;
	}
	
	public SourceLocation combine(SourceLocation other) {
		if(isUnknown()) {
			return other;
		}else if(other.isUnknown()) {
			return this;
		}
		// combining spans of two different declarations is a programmer error
		if(!source.equals(other.getSource())) {
			throw new RuntimeException("Tried to combine source locations from two different texts: " + source + ", " + other.getSource());
		}
		return new SourceLocation(source,
				Integer.min(startOffset, other.startOffset),
				Integer.max(endOffset, other.endOffset));
	}

	/**
	 * @return the text covered by this location
	 */
	public String getText() {
		if(isUnknown()) {
			return "";
		}
		return source.substring(startOffset, Integer.min(endOffset, source.length()));
	}

	public String getSource() {
		return source;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	@Override
	public int hashCode() {
		return Objects.hash(source, startOffset, endOffset);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return startOffset == other.startOffset && endOffset == other.endOffset &&
				Objects.equals(source, other.source);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		} else {
			return "SourceLocation [source=" + source + ", startOffset=" + startOffset + ", endOffset=" + endOffset + "]";
		}
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		int comparedSource = getSource().compareTo(o.getSource());
		if (comparedSource != 0) {
			return comparedSource;
		}
		int comparedStartOffset = Integer.compare(getStartOffset(), o.getStartOffset());
		if (comparedStartOffset != 0) {
			return comparedStartOffset;
		}
		return Integer.compare(getEndOffset(), o.getEndOffset());
	}

}
