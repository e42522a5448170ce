package org.springaicommunity.team.validator;

import java.util.List;

/**
 * A code-host team resolved against the people data.
 *
 * @param org the GitHub organization
 * @param name the team slug
 * @param memberIds GitHub ids of the team's effective members, sorted
 */
public record GitHubTeam(String org, String name, List<Long> memberIds) {

	public GitHubTeam {
		memberIds = List.copyOf(memberIds);
	}

	/**
	 * Returns the {@code (org, name)} key of this team.
	 * @return the mapping this team was resolved from
	 */
	public GitHubTeamMapping key() {
		return new GitHubTeamMapping(org, name);
	}

}
