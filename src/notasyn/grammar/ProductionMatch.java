package notasyn.grammar;

import notasyn.model.grammar.ListMark;

import java.util.Collections;
import java.util.List;

/**
 * One way a production matched a token list: the token captured by each non-terminal, in order.
 */
public class ProductionMatch {

	public static class Capture {
		private final String variable;
		private final String token;
		private final boolean listed;

		public Capture(String variable, String token, boolean listed) {
			this.variable = variable;
			this.token = token;
			this.listed = listed;
		}

		public String getVariable() {
			return variable;
		}

		public String getToken() {
			return token;
		}

		/**
		 * @return whether the token was captured by one of the slots a list mark covers
		 */
		public boolean isListed() {
			return listed;
		}

		@Override
		public String toString() {
			return variable + "=" + token;
		}
	}

	private final List<Capture> captures;
	private final ListMark mark;

	public ProductionMatch(List<Capture> captures, ListMark mark) {
		this.captures = Collections.unmodifiableList(captures);
		this.mark = mark;
	}

	public List<Capture> getCaptures() {
		return captures;
	}

	/**
	 * @return the list mark of the production, or null if it does not come from a recursive list
	 */
	public ListMark getMark() {
		return mark;
	}

	@Override
	public String toString() {
		return captures.toString();
	}
}
