package solclar.parser;

import solclar.util.SourceLocation;

/**
 * Base of every failure the lexer or parser can report. Any of these aborts the parse of the whole text.
 */
public abstract class ParsingError extends Exception {

	private static final long serialVersionUID = -3009152367624531390L;

	private final String description;
	private final SourceLocation location;

	protected ParsingError(String description, SourceLocation location) {
		super(description + " " + location.prettyString());
		this.description = description;
		this.location = location;
	}

	public String getDescription() {
		return description;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public abstract <T, E extends Throwable> T accept(ParsingErrorVisitor<T, E> v) throws E;
}
