package notasyn;

public class NotaSynOptionException extends Exception {
	private static final long serialVersionUID = 3518724302746620311L;

	public NotaSynOptionException(String msg) {
		super(msg);
	}
}
