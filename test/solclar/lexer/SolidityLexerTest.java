package solclar.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import solclar.parser.SyntaxError;
import solclar.util.SourceLocation;

@RunWith(Parameterized.class)
public class SolidityLexerTest {

	static Path testFile = Paths.get("TEST");

	private static SolidityToken tok(String value, SolidityTokenType type, int line, int column, int offset) {
		return new SolidityToken(value, type, new SourceLocation(
				testFile, offset, offset + value.length(), line, line, column, column + value.length()));
	}

	private static SolidityTokenType ident() {
		return SolidityTokenType.IDENT;
	}

	private static SolidityTokenType num() {
		return SolidityTokenType.NUMBER;
	}

	private static SolidityTokenType str() {
		return SolidityTokenType.STRING;
	}

	private static SolidityTokenType builtin() {
		return SolidityTokenType.BUILTIN;
	}

	private static SolidityToken eof(int line, int column, int offset) {
		return tok("", SolidityTokenType.EOF, line, column, offset);
	}

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
			{ "", Arrays.asList(eof(1, 1, 0)) },
			{ "contract", Arrays.asList(tok("contract", builtin(), 1, 1, 0), eof(1, 9, 8)) },
			{ "uint256 count;", Arrays.asList(
					tok("uint256", ident(), 1, 1, 0),
					tok("count", ident(), 1, 9, 8),
					tok(";", builtin(), 1, 14, 13),
					eof(1, 15, 14))
			},
			{ "a=>b", Arrays.asList(
					tok("a", ident(), 1, 1, 0),
					tok("=>", builtin(), 1, 2, 1),
					tok("b", ident(), 1, 4, 3),
					eof(1, 5, 4))
			},
			{ "x <= 0x1F", Arrays.asList(
					tok("x", ident(), 1, 1, 0),
					tok("<=", builtin(), 1, 3, 2),
					tok("0x1F", num(), 1, 6, 5),
					eof(1, 10, 9))
			},
			{ "public view", Arrays.asList(
					tok("public", builtin(), 1, 1, 0),
					tok("view", builtin(), 1, 8, 7),
					eof(1, 12, 11))
			},
			{ "// comment\nfoo", Arrays.asList(
					tok("foo", ident(), 2, 1, 11),
					eof(2, 4, 14))
			},
			{ "/* a\n b */ \"hi\"", Arrays.asList(
					tok("\"hi\"", str(), 2, 7, 11),
					eof(2, 11, 15))
			},
			{ "m[k]=1", Arrays.asList(
					tok("m", ident(), 1, 1, 0),
					tok("[", builtin(), 1, 2, 1),
					tok("k", ident(), 1, 3, 2),
					tok("]", builtin(), 1, 4, 3),
					tok("=", builtin(), 1, 5, 4),
					tok("1", num(), 1, 6, 5),
					eof(1, 7, 6))
			},
			{ "msg.sender", Arrays.asList(
					tok("msg", ident(), 1, 1, 0),
					tok(".", builtin(), 1, 4, 3),
					tok("sender", ident(), 1, 5, 4),
					eof(1, 11, 10))
			},
		});
	}

	private final String input;
	private final List<SolidityToken> expected;

	public SolidityLexerTest(String input, List<SolidityToken> expected) {
		this.input = input;
		this.expected = expected;
	}

	@Test
	public void test() throws SyntaxError {
		SolidityLexer lexer = new SolidityLexer(testFile, input);
		assertThat(lexer.readTokens(), is(expected));
	}

}
