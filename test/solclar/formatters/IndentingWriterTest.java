package solclar.formatters;

import org.junit.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class IndentingWriterTest {

	@Test
	public void indentsNestedLines() throws IOException {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		out.write("(begin");
		out.newLine();
		try(IndentingWriter.Indent ignored = out.indent()) {
			out.write("(a)");
			out.newLine();
			try(IndentingWriter.Indent ignored2 = out.indent()) {
				out.write("(b)");
				out.newLine();
			}
			out.write("(c))");
		}
		out.newLine();
		out.write("end");
		assertThat(w.toString(), is("(begin\n  (a)\n    (b)\n  (c))\nend"));
	}

	@Test
	public void blankLinesCarryNoIndentation() throws IOException {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try(IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			out.write("x\n\ny");
		}
		assertThat(w.toString(), is("\n  x\n\n  y"));
	}

	@Test(expected = RuntimeException.class)
	public void cannotUnindentBelowZero() {
		new IndentingWriter(new StringWriter()).unindent(1);
	}
}
