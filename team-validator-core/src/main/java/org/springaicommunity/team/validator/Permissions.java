package org.springaicommunity.team.validator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Capabilities granted to a person, a team, or a team's leads.
 *
 * <p>
 * Grants are named either after a boolean permission declared in the configuration
 * ({@code perf}, {@code crater}, ...) or after a bors repository permission
 * ({@code bors.<repo>.review}, {@code bors.<repo>.try}).
 *
 * @param granted the names of the granted capabilities, serialized as a plain JSON array
 */
public record Permissions(Set<String> granted) {

	private static final String BORS_PREFIX = "bors.";

	private static final Permissions NONE = new Permissions(Set.of());

	@JsonCreator(mode = JsonCreator.Mode.DELEGATING)
	public Permissions {
		granted = granted == null ? Set.of() : Set.copyOf(granted);
	}

	@Override
	@JsonValue
	public Set<String> granted() {
		return granted;
	}

	public static Permissions none() {
		return NONE;
	}

	public static Permissions of(String... granted) {
		return new Permissions(Set.of(granted));
	}

	public boolean has(String permission) {
		return granted.contains(permission);
	}

	public boolean hasAny() {
		return !granted.isEmpty();
	}

	/**
	 * Check every grant against the configured permissions.
	 * @param what description of the holder used in messages, e.g. "team `infra`"
	 * @param config the configuration declaring the available permissions
	 * @throws ViolationException on the first unknown grant, or when a bors review
	 * permission is granted without the matching try permission
	 */
	public void validate(String what, TeamConfig config) throws ViolationException {
		Set<String> available = config.availablePermissions();
		for (String permission : new TreeSet<>(granted)) {
			if (!available.contains(permission)) {
				throw new ViolationException(
						"unknown permission `" + permission + "` for " + what + " (maybe add it to the config?)");
			}
		}
		for (String repo : borsRepos(granted)) {
			if (has(borsReview(repo)) && !has(borsTry(repo))) {
				throw new ViolationException(what + " has review permissions but not try on repo " + repo);
			}
		}
	}

	static String borsReview(String repo) {
		return BORS_PREFIX + repo + ".review";
	}

	static String borsTry(String repo) {
		return BORS_PREFIX + repo + ".try";
	}

	private static Set<String> borsRepos(Collection<String> names) {
		Set<String> repos = new TreeSet<>();
		for (String name : names) {
			if (name.startsWith(BORS_PREFIX) && name.lastIndexOf('.') > BORS_PREFIX.length()) {
				repos.add(name.substring(BORS_PREFIX.length(), name.lastIndexOf('.')));
			}
		}
		return repos;
	}

}
