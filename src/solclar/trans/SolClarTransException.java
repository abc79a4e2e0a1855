package solclar.trans;

import solclar.SolClarException;

/**
 * Raised when translating a source file reported issues. The message is the formatted issue report.
 */
public class SolClarTransException extends SolClarException {

	private static final long serialVersionUID = -4471623054380172115L;

	public SolClarTransException(String report) {
		super("Translation Error", report);
	}
}
