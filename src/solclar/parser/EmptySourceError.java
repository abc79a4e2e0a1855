package solclar.parser;

import solclar.util.SourceLocation;

/**
 * The text contains no contract declaration.
 */
public class EmptySourceError extends ParsingError {

	private static final long serialVersionUID = 8712393087262451772L;

	public EmptySourceError(String description, SourceLocation location) {
		super(description, location);
	}

	@Override
	public <T, E extends Throwable> T accept(ParsingErrorVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
