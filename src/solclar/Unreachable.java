package solclar;

/**
 * Thrown where a checked exception cannot happen, such as an {@link java.io.IOException} from a
 * {@link java.io.StringWriter}.
 */
public class Unreachable extends RuntimeException {

	private static final long serialVersionUID = -2749416723021398812L;

	public Unreachable(Exception cause) {
		super("unreachable", cause);
	}
}
