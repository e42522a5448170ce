package org.springaicommunity.team.validator;

/**
 * A check paired with the stable name used to skip it and to report it.
 *
 * @param name stable check name, e.g. {@code subteam-of}
 * @param check the check function
 * @param <F> check function type
 */
public record NamedCheck<F>(String name, F check) {

	public static <F> NamedCheck<F> of(String name, F check) {
		return new NamedCheck<>(name, check);
	}

}
