package solclar.parser;

/**
 * Receives a description of each decision the parser makes. The parser never prints on its own; callers that want
 * to see what it is doing pass an implementation of this interface.
 */
public interface ParseTrace {

	ParseTrace NONE = message -> {};

	void trace(String message);

}
