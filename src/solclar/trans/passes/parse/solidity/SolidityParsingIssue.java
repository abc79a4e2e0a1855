package solclar.trans.passes.parse.solidity;

import solclar.errors.Issue;
import solclar.errors.IssueVisitor;
import solclar.parser.ParsingError;
import solclar.util.SourceLocation;

/**
 * A source file that could not be parsed. Parsing stops at the first error, so a file yields at most one of these.
 */
public class SolidityParsingIssue extends Issue {

	private final ParsingError error;

	public SolidityParsingIssue(ParsingError error) {
		initCause(error);
		this.error = error;
	}

	public ParsingError getError() {
		return error;
	}

	public SourceLocation getLocation() {
		return error.getLocation();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
