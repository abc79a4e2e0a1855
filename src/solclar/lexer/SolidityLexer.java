package solclar.lexer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import solclar.parser.SolidityGrammar;
import solclar.parser.SyntaxError;
import solclar.util.SourceLocation;

/**
 * A lexer for the Solidity subset described by {@link SolidityGrammar}.
 *
 * Whitespace and comments are dropped. Identifiers that spell a keyword are reported as
 * {@link SolidityTokenType#BUILTIN}, as are all punctuation and operators. The token list always ends
 * with a single {@link SolidityTokenType#EOF} token.
 */
public class SolidityLexer {

	static final Pattern WHITESPACE = Pattern.compile("\\s+");

	static final Pattern LINE_COMMENT = Pattern.compile("//[^\\n]*");
	static final Pattern COMMENT_START = Pattern.compile("/\\*");
	static final Pattern COMMENT_END = Pattern.compile("\\*/");

	static final Pattern IDENT = Pattern.compile("[a-zA-Z_$][a-zA-Z0-9_$]*");

	static final Pattern[] NUMBER = {
		Pattern.compile("0[xX][0-9a-fA-F]+"),
		Pattern.compile("[0-9]+"),
	};

	static final Pattern STRING = Pattern.compile("\"([^\"\\\\\\n]|\\\\.)*\"");
	static final Pattern STRING_START = Pattern.compile("\"");

	private final Path file;
	private final CharSequence text;

	private int offset;
	private int line;
	private int column;

	public SolidityLexer(Path file, CharSequence text) {
		this.file = file;
		this.text = text;
	}

	private SourceLocation locationOf(int length) {
		return new SourceLocation(file, offset, offset + length, line, line, column, column + length);
	}

	private SolidityToken makeToken(String value, SolidityTokenType type) {
		return new SolidityToken(value, type, locationOf(value.length()));
	}

	// moves the cursor forward, keeping line and column in step
	private void advanceTo(int newOffset) {
		while(offset < newOffset) {
			if(text.charAt(offset) == '\n') {
				++line;
				column = 1;
			}else {
				++column;
			}
			++offset;
		}
	}

	private Matcher lookingAt(Pattern pattern) {
		Matcher m = pattern.matcher(text);
		m.region(offset, text.length());
		if(m.lookingAt()) {
			return m;
		}
		return null;
	}

	/**
	 * @return a list of tokens scanned from the text the lexer was given, terminated by an EOF token
	 * @throws SyntaxError if part of the input is not a token of the language, or a string or comment is
	 * not terminated
	 */
	public List<SolidityToken> readTokens() throws SyntaxError {
		List<SolidityToken> tokens = new ArrayList<>();
		offset = 0;
		line = 1;
		column = 1;
		while(offset < text.length()) {
			Matcher m = lookingAt(WHITESPACE);
			if(m != null) {
				advanceTo(m.end());
				continue;
			}

			m = lookingAt(LINE_COMMENT);
			if(m != null) {
				advanceTo(m.end());
				continue;
			}

			m = lookingAt(COMMENT_START);
			if(m != null) {
				Matcher end = COMMENT_END.matcher(text);
				end.region(m.end(), text.length());
				if(!end.find()) {
					throw new SyntaxError("unterminated comment", locationOf(2));
				}
				advanceTo(end.end());
				continue;
			}

			m = lookingAt(STRING);
			if(m != null) {
				tokens.add(makeToken(m.group(), SolidityTokenType.STRING));
				advanceTo(m.end());
				continue;
			}
			if(lookingAt(STRING_START) != null) {
				throw new SyntaxError("unterminated string literal", locationOf(1));
			}

			// the longest number wins, so that 0x10 is not read as 0 followed by x10
			String possibleNumber = null;
			for(Pattern numberPattern : NUMBER) {
				m = lookingAt(numberPattern);
				if(m != null && (possibleNumber == null || m.group().length() > possibleNumber.length())) {
					possibleNumber = m.group();
				}
			}
			if(possibleNumber != null) {
				tokens.add(makeToken(possibleNumber, SolidityTokenType.NUMBER));
				advanceTo(offset + possibleNumber.length());
				continue;
			}

			m = lookingAt(IDENT);
			if(m != null) {
				String word = m.group();
				SolidityTokenType type = SolidityGrammar.KEYWORDS.contains(word) ?
						SolidityTokenType.BUILTIN : SolidityTokenType.IDENT;
				tokens.add(makeToken(word, type));
				advanceTo(m.end());
				continue;
			}

			String symbol = null;
			for(String candidate : SolidityGrammar.SYMBOLS) {
				if(text.length() - offset >= candidate.length()
						&& text.subSequence(offset, offset + candidate.length()).toString().equals(candidate)) {
					symbol = candidate;
					break;
				}
			}
			if(symbol != null) {
				tokens.add(makeToken(symbol, SolidityTokenType.BUILTIN));
				advanceTo(offset + symbol.length());
				continue;
			}

			throw new SyntaxError("unexpected character '" + text.charAt(offset) + "'", locationOf(1));
		}
		tokens.add(makeToken("", SolidityTokenType.EOF));
		return tokens;
	}
}
