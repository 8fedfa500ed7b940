package notasyn;

/**
 * A NotaSyn Exception consisting of a prefix (type of error) and a message
 * describing what went wrong while processing a notation
 *
 */
public abstract class NotaSynException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public NotaSynException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
