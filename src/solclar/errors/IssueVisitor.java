package solclar.errors;

import solclar.trans.intermediate.IOErrorIssue;
import solclar.trans.passes.parse.option.OptionParserIssue;
import solclar.trans.passes.parse.solidity.SolidityParsingIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(SolidityParsingIssue solidityParsingIssue) throws E;
}
