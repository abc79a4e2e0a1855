package solclar.util;

import solclar.Unreachable;
import solclar.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A range of source text. Offsets are 0-based character offsets into the text, lines and columns are 1-based.
 * The file is purely informational and may be null when the text did not come from a file.
 */
public class SourceLocation {
	private static final SourceLocation UNKNOWN = new SourceLocation(null, -1, -1, -1, -1, -1, -1);

	private final Path file;
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(Path file, int startOffset, int endOffset, int startLine, int endLine, int startColumn,
	                      int endColumn) {
		this.file = file;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public static SourceLocation unknown() {
		return UNKNOWN;
	}

	public boolean isUnknown() {
		return startOffset < 0;
	}

	/**
	 * @return the smallest range covering both this range and the other one. Both must come from the same text;
	 * an unknown location leaves the other one unchanged.
	 */
	public SourceLocation combine(SourceLocation other) {
		if(isUnknown()) {
			return other;
		}
		if(other.isUnknown()) {
			return this;
		}
		if(!Objects.equals(file, other.file)) {
			throw new IllegalArgumentException("cannot combine locations in " + file + " and " + other.file);
		}
		SourceLocation first = startOffset <= other.startOffset ? this : other;
		SourceLocation last = endOffset >= other.endOffset ? this : other;
		return new SourceLocation(file, first.startOffset, last.endOffset, first.startLine, last.endLine,
				first.startColumn, last.endColumn);
	}

	public void writePretty(IndentingWriter out) {
		try {
			if(isUnknown()) {
				out.write("at unknown source location");
				return;
			}
			out.write("at " + startLine + ":" + startColumn);
			if(startLine != endLine) {
				out.write("-" + endLine + ":" + endColumn);
			}else if(startColumn != endColumn) {
				out.write("-" + endColumn);
			}
			if(file != null) {
				out.write(" in file " + file);
			}
		} catch (IOException e) {
			throw new Unreachable(e);
		}
	}

	public String prettyString() {
		StringWriter w = new StringWriter();
		writePretty(new IndentingWriter(w));
		return w.toString();
	}

	public Path getFile() {
		return file;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public boolean equals(Object o) {
		if(this == o) return true;
		if(o == null || getClass() != o.getClass()) return false;
		SourceLocation that = (SourceLocation) o;
		return startOffset == that.startOffset && endOffset == that.endOffset &&
				startLine == that.startLine && endLine == that.endLine &&
				startColumn == that.startColumn && endColumn == that.endColumn &&
				Objects.equals(file, that.file);
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startOffset, endOffset, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public String toString() {
		return isUnknown() ? "SourceLocation [unknown]" : "SourceLocation [" + prettyString() + "]";
	}
}
