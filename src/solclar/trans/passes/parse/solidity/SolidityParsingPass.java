package solclar.trans.passes.parse.solidity;

import solclar.errors.Issue;
import solclar.model.solidity.SolidityContract;
import solclar.parser.ParseTrace;
import solclar.parser.ParsingError;
import solclar.parser.SolidityParser;

import java.nio.file.Path;
import java.util.List;

public class SolidityParsingPass {
	private SolidityParsingPass() {}

	public static List<SolidityContract> perform(Path inputFileName, CharSequence inputFileContents,
	                                             ParseTrace trace) throws Issue {
		try {
			return SolidityParser.readContracts(inputFileName, inputFileContents, trace);
		} catch (ParsingError e) {
			throw new SolidityParsingIssue(e);
		}
	}
}
