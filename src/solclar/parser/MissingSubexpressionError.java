package solclar.parser;

import solclar.util.SourceLocation;

/**
 * A required type or expression is missing, such as the key or value type of a mapping.
 */
public class MissingSubexpressionError extends ParsingError {

	private static final long serialVersionUID = 5520498126047300903L;

	public MissingSubexpressionError(String description, SourceLocation location) {
		super(description, location);
	}

	@Override
	public <T, E extends Throwable> T accept(ParsingErrorVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
