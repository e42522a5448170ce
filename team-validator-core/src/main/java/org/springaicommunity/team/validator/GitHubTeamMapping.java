package org.springaicommunity.team.validator;

/**
 * A code-host team a team is mirrored to.
 *
 * @param org the GitHub organization
 * @param name the team slug inside the organization
 */
public record GitHubTeamMapping(String org, String name) {

	@Override
	public String toString() {
		return org + "/" + name;
	}

}
