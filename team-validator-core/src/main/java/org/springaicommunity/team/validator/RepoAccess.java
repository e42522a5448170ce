package org.springaicommunity.team.validator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Access grants of a repository.
 *
 * @param teams GitHub team slug to permission
 * @param individuals GitHub handle to permission
 */
public record RepoAccess(Map<String, RepoPermission> teams, Map<String, RepoPermission> individuals) {

	public RepoAccess {
		teams = teams == null ? Map.of() : unmodifiable(teams);
		individuals = individuals == null ? Map.of() : unmodifiable(individuals);
	}

	public static RepoAccess none() {
		return new RepoAccess(Map.of(), Map.of());
	}

	private static Map<String, RepoPermission> unmodifiable(Map<String, RepoPermission> source) {
		return Collections.unmodifiableMap(new LinkedHashMap<>(source));
	}

}
