package org.springaicommunity.team.validator;

/**
 * Helpers shared by the check implementations.
 */
final class CheckSupport {

	private CheckSupport() {
	}

	/**
	 * Apply {@code check} to every item, recording each failure as one violation and
	 * moving on to the next item.
	 * @param items items to check
	 * @param errors accumulator for violations
	 * @param check per-item predicate
	 * @param <T> item type
	 */
	static <T> void forEach(Iterable<? extends T> items, ValidationErrors errors, ItemCheck<T> check) {
		for (T item : items) {
			try {
				check.check(item, errors);
			}
			catch (ViolationException | TeamDataException e) {
				errors.add(e.getMessage());
			}
		}
	}

}
