package solclar.parser;

import solclar.util.SourceLocation;

/**
 * The text does not match the grammar.
 */
public class SyntaxError extends ParsingError {

	private static final long serialVersionUID = -6415094281367715301L;

	public SyntaxError(String description, SourceLocation location) {
		super(description, location);
	}

	@Override
	public <T, E extends Throwable> T accept(ParsingErrorVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
