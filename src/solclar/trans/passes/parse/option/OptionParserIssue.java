package solclar.trans.passes.parse.option;

import solclar.errors.Issue;
import solclar.errors.IssueVisitor;

public class OptionParserIssue extends Issue {
	private final String message;

	public OptionParserIssue(String message) {
		this.message = message;
	}

	public String getDescription() {
		return message;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
