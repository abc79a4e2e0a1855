package solclar.util;

/**
 * Anything that came from a range of source text: tokens and AST nodes.
 */
public abstract class SourceLocatable {

	public abstract SourceLocation getLocation();

}
