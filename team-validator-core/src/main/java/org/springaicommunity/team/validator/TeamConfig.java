package org.springaicommunity.team.validator;

import java.util.Set;
import java.util.TreeSet;

/**
 * Global configuration of the team data: allow-lists and declared permissions.
 *
 * @param allowedGithubOrgs organizations teams and repositories may live in
 * @param allowedMailingListDomains domains mailing lists may be hosted on
 * @param permissionBools boolean permissions that may be granted
 * @param permissionBorsRepos repositories bors permissions may be granted for
 */
public record TeamConfig(Set<String> allowedGithubOrgs, Set<String> allowedMailingListDomains,
		Set<String> permissionBools, Set<String> permissionBorsRepos) {

	public TeamConfig {
		allowedGithubOrgs = allowedGithubOrgs == null ? Set.of() : Set.copyOf(allowedGithubOrgs);
		allowedMailingListDomains = allowedMailingListDomains == null ? Set.of()
				: Set.copyOf(allowedMailingListDomains);
		permissionBools = permissionBools == null ? Set.of() : Set.copyOf(permissionBools);
		permissionBorsRepos = permissionBorsRepos == null ? Set.of() : Set.copyOf(permissionBorsRepos);
	}

	public static TeamConfig empty() {
		return new TeamConfig(Set.of(), Set.of(), Set.of(), Set.of());
	}

	/**
	 * Returns every permission name that may be granted, in sorted order: the boolean
	 * permissions plus {@code bors.<repo>.review} and {@code bors.<repo>.try} for each bors
	 * repository.
	 * @return sorted permission names
	 */
	public Set<String> availablePermissions() {
		Set<String> available = new TreeSet<>(permissionBools);
		for (String repo : permissionBorsRepos) {
			available.add(Permissions.borsReview(repo));
			available.add(Permissions.borsTry(repo));
		}
		return available;
	}

}
