package org.springaicommunity.team.validator;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Accumulates violation messages across all checks of a validation run.
 *
 * <p>
 * Owned by {@link TeamValidator} and passed to one check at a time; not thread-safe.
 */
public final class ValidationErrors {

	private final List<String> messages = new ArrayList<>();

	public void add(String message) {
		messages.add(message);
	}

	public boolean isEmpty() {
		return messages.isEmpty();
	}

	public int size() {
		return messages.size();
	}

	/**
	 * Returns the recorded messages in the order they were added, duplicates included.
	 * @return recorded messages
	 */
	public List<String> messages() {
		return List.copyOf(messages);
	}

	/**
	 * Returns the recorded messages deduplicated by exact string equality and sorted
	 * lexicographically.
	 * @return the final report
	 */
	public List<String> sortedDistinct() {
		return List.copyOf(new TreeSet<>(messages));
	}

}
