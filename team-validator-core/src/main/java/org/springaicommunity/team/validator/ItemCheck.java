package org.springaicommunity.team.validator;

/**
 * Predicate applied to one item of a check's input. Throwing reports the item as one
 * violation; further violations for the same item may be added to {@code errors}
 * directly.
 *
 * @param <T> item type
 */
@FunctionalInterface
public interface ItemCheck<T> {

	void check(T item, ValidationErrors errors) throws ViolationException, TeamDataException;

}
