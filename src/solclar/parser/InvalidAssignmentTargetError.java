package solclar.parser;

import solclar.util.SourceLocation;

/**
 * The left-hand side of an assignment is neither an identifier nor an indexed access.
 */
public class InvalidAssignmentTargetError extends ParsingError {

	private static final long serialVersionUID = -242715506622154839L;

	public InvalidAssignmentTargetError(String description, SourceLocation location) {
		super(description, location);
	}

	@Override
	public <T, E extends Throwable> T accept(ParsingErrorVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
