package solclar;

/**
 * Base of the unchecked exceptions solclar raises. The message is prefixed with the kind of failure.
 */
public abstract class SolClarException extends RuntimeException {

	private static final long serialVersionUID = 6512309863409127744L;

	protected SolClarException(String kind, String message) {
		super(kind + ": " + message);
	}
}
