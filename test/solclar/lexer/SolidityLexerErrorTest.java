package solclar.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

import solclar.parser.SyntaxError;

public class SolidityLexerErrorTest {

	private static SyntaxError lexFailure(String input) {
		try {
			new SolidityLexer(null, input).readTokens();
		} catch (SyntaxError e) {
			return e;
		}
		fail("expected a syntax error lexing " + input);
		return null;
	}

	@Test
	public void unterminatedString() {
		SyntaxError e = lexFailure("x = \"abc;");
		assertThat(e.getDescription(), is("unterminated string literal"));
		assertThat(e.getLocation().getStartColumn(), is(5));
	}

	@Test
	public void unterminatedComment() {
		SyntaxError e = lexFailure("a /* never closed");
		assertThat(e.getDescription(), is("unterminated comment"));
		assertThat(e.getLocation().getStartOffset(), is(2));
	}

	@Test
	public void unexpectedCharacter() {
		SyntaxError e = lexFailure("a\n  @b");
		assertThat(e.getDescription(), containsString("'@'"));
		assertThat(e.getLocation().getStartLine(), is(2));
		assertThat(e.getLocation().getStartColumn(), is(3));
	}

}
