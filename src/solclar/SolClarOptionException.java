package solclar;

public class SolClarOptionException extends Exception {

	private static final long serialVersionUID = 2113583410475209374L;

	public SolClarOptionException(String msg) {
		super(msg);
	}

}
