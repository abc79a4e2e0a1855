package solclar.parser;

import solclar.util.SourceLocation;

/**
 * A contract, function or state variable declaration is missing its identifier.
 */
public class MissingNameError extends ParsingError {

	private static final long serialVersionUID = 3374112069180035614L;

	public MissingNameError(String description, SourceLocation location) {
		super(description, location);
	}

	@Override
	public <T, E extends Throwable> T accept(ParsingErrorVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
