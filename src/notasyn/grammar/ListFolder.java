package notasyn.grammar;

import notasyn.model.grammar.ListMark;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Rebuilds a recursive list from whichever production of its family matched. The slots covered by
 * the list mark capture the list elements followed by the trailing variables the family absorbed.
 */
public class ListFolder {

	public static class Fold {
		private final List<String> elements;
		private final List<String> trailing;

		public Fold(List<String> elements, List<String> trailing) {
			this.elements = Collections.unmodifiableList(elements);
			this.trailing = Collections.unmodifiableList(trailing);
		}

		public List<String> getElements() {
			return elements;
		}

		public List<String> getTrailing() {
			return trailing;
		}
	}

	private ListFolder() {}

	/**
	 * @return the list elements and trailing variables of the match, or null if the matched
	 * production has no list mark
	 */
	public static Fold collect(ProductionMatch match) {
		ListMark mark = match.getMark();
		if (mark == null) {
			return null;
		}
		List<String> listed = new ArrayList<>();
		for (ProductionMatch.Capture capture : match.getCaptures()) {
			if (capture.isListed()) {
				listed.add(capture.getToken());
			}
		}
		int split = listed.size() - mark.getTrailing();
		return new Fold(new ArrayList<>(listed.subList(0, split)), new ArrayList<>(listed.subList(split, listed.size())));
	}

	/**
	 * Folds the elements into a right-nested structure: step(e1, step(e2, ... step(en, terminator))).
	 */
	public static <E, T> T foldRight(List<E> elements, T terminator, BiFunction<E, T, T> step) {
		T acc = terminator;
		for (int i = elements.size() - 1; i >= 0; i--) {
			acc = step.apply(elements.get(i), acc);
		}
		return acc;
	}
}
