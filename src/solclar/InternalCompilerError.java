package solclar;

public class InternalCompilerError extends RuntimeException {
	public InternalCompilerError(String detail) {
		super("internal compiler error: " + detail);
	}
}
