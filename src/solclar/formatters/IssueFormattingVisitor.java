package solclar.formatters;

import solclar.errors.IssueVisitor;
import solclar.errors.IssueWithContext;
import solclar.trans.intermediate.IOErrorIssue;
import solclar.trans.passes.parse.option.OptionParserIssue;
import solclar.trans.passes.parse.solidity.SolidityParsingIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getDescription());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("I/O error: ");
		out.write(ioErrorIssue.getDescription());
		return null;
	}

	@Override
	public Void visit(SolidityParsingIssue solidityParsingIssue) throws IOException {
		out.write("error parsing Solidity: ");
		solidityParsingIssue.getError().accept(new ParsingErrorFormattingVisitor(out));
		return null;
	}
}
