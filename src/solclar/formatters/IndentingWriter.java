package solclar.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that prefixes every line it writes with the current indentation. Lines are always terminated
 * with {@code \n}, regardless of platform, so that generated contracts are byte-for-byte stable.
 */
public class IndentingWriter extends Writer {

	public static final String NEWLINE = "\n";

	private final Writer out;
	private int indent = 0;
	private boolean shouldIndent = false;
	private static final int INDENT = 2;

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
		this.out = out;
	}

	/**
	 * Indents every line started before the returned {@link Indent} is closed by two more spaces.
	 */
	public Indent indent() {
		indent += INDENT;
		return new Indent(this, INDENT);
	}

	public void unindent(int spaces) {
		if(spaces > indent) {
			throw new RuntimeException("can't unindent below 0");
		}
		indent -= spaces;
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	public void newLine() throws IOException {
		write(NEWLINE);
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while(start < data.length()) {
			// blank lines are written without trailing indentation
			if(shouldIndent && !data.startsWith(NEWLINE, start)) {
				for(int i = 0; i < indent; ++i) {
					out.write(" ");
				}
				shouldIndent = false;
			}
			int next = data.indexOf(NEWLINE, start);
			if(next != -1) {
				out.write(data, start, next + NEWLINE.length() - start);
				start = next + NEWLINE.length();
				shouldIndent = true;
			}else {
				out.write(data.substring(start));
				break;
			}
		}
	}

}
