package notasyn;

public class InternalCompilerError extends RuntimeException {
	public InternalCompilerError() {
		super("internal error");
	}

	public InternalCompilerError(String msg) {
		super("internal error: " + msg);
	}

	public InternalCompilerError(Exception e) {
		super("internal error", e);
	}
}
