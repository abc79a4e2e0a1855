package solclar.trans.passes.parse.solidity;

import solclar.parser.ParseTrace;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Forwards parser decisions to a logger at {@link Level#FINE}.
 */
public class LoggerParseTrace implements ParseTrace {

	private final Logger logger;

	public LoggerParseTrace(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void trace(String message) {
		logger.fine(message);
	}
}
