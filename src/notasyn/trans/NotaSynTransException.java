package notasyn.trans;

import notasyn.NotaSynException;

/**
 * Exception raised while turning a notation declaration into grammar and printing rules
 *
 */
public class NotaSynTransException extends NotaSynException {

	private static final long serialVersionUID = -6391847602711553092L;
	private static final String prefix = "Notation Error";

	public NotaSynTransException(String msg) {
		super(prefix, msg);
	}

}
