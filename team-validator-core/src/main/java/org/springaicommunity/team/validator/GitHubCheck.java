package org.springaicommunity.team.validator;

/**
 * A check that needs the GitHub directory.
 */
@FunctionalInterface
public interface GitHubCheck {

	void run(TeamData data, GitHubDirectory github, ValidationErrors errors);

}
