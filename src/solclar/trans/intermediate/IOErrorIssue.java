package solclar.trans.intermediate;

import solclar.errors.Issue;
import solclar.errors.IssueVisitor;

import java.io.IOException;

/**
 * A source, configuration or output file that could not be read or written. The file itself is named by the
 * enclosing context.
 */
public class IOErrorIssue extends Issue {

	private final IOException error;

	public IOErrorIssue(IOException error) {
		initCause(error);
		this.error = error;
	}

	public IOException getError() {
		return error;
	}

	// commons-io messages already name the file, the bare exception class says nothing more
	public String getDescription() {
		String message = error.getMessage();
		return message != null ? message : error.getClass().getSimpleName();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
