package solclar.formatters;

import org.junit.Test;
import solclar.errors.TopLevelIssueContext;
import solclar.parser.MissingNameError;
import solclar.parser.SyntaxError;
import solclar.trans.intermediate.IOErrorIssue;
import solclar.trans.intermediate.WhileReadingFile;
import solclar.trans.intermediate.WhileWritingContract;
import solclar.trans.passes.parse.option.OptionParserIssue;
import solclar.trans.passes.parse.solidity.SolidityParsingIssue;
import solclar.util.SourceLocation;

import java.io.IOException;
import java.nio.file.Paths;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class IssueFormattingVisitorTest {

	@Test
	public void noIssues() {
		assertThat(new TopLevelIssueContext().format(), is("Detected 0 issue(s):"));
	}

	@Test
	public void optionIssue() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ctx.error(new OptionParserIssue("Expected exactly one input file, found 0"));
		assertThat(ctx.format(), is(
				"Detected 1 issue(s):\n" +
				"unable to parse options: Expected exactly one input file, found 0"));
	}

	@Test
	public void parsingIssueInContext() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		SourceLocation location = new SourceLocation(Paths.get("Broken.sol"), 10, 11, 2, 2, 5, 6);
		ctx.withContext(new WhileReadingFile(Paths.get("Broken.sol")))
				.error(new SolidityParsingIssue(new SyntaxError("expected ';' but found '}'", location)));
		ctx.error(new SolidityParsingIssue(new MissingNameError("expected a contract name",
				SourceLocation.unknown())));
		assertThat(ctx.format(), is(
				"Detected 2 issue(s):\n" +
				"while reading file Broken.sol\n" +
				"  error parsing Solidity: syntax error: expected ';' but found '}' at 2:5-6 in file Broken.sol\n" +
				"error parsing Solidity: missing name: expected a contract name at unknown source location"));
	}

	@Test
	public void ioIssueWhileWriting() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ctx.withContext(new WhileWritingContract("Token", Paths.get("out", "token.clar")))
				.error(new IOErrorIssue(new IOException("disk full")));
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.format(), is(
				"Detected 1 issue(s):\n" +
				"while writing contract Token to " + Paths.get("out", "token.clar") + "\n" +
				"  I/O error: disk full"));
	}
}
