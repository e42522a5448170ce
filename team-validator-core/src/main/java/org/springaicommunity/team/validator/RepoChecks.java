package org.springaicommunity.team.validator;

import java.util.Set;

import static org.springaicommunity.team.validator.CheckSupport.forEach;

/**
 * Checks over repository declarations.
 */
final class RepoChecks {

	private RepoChecks() {
	}

	/**
	 * Repositories must live in an allowed organization and only grant access to declared
	 * code-host teams and known people.
	 */
	static void validateRepos(TeamData data, ValidationErrors errors) {
		Set<String> allowedOrgs = data.config().allowedGithubOrgs();
		Set<GitHubTeamMapping> githubTeams = data.githubTeamKeys();
		forEach(data.repos(), errors, (Repo repo, ValidationErrors e) -> {
			if (!allowedOrgs.contains(repo.org())) {
				throw new ViolationException(
						"The repo `" + repo.name() + "` is in an invalid org `" + repo.org() + "`");
			}
			for (String teamName : repo.access().teams().keySet()) {
				if (!githubTeams.contains(new GitHubTeamMapping(repo.org(), teamName))) {
					throw new ViolationException("access for " + repo.org() + "/" + repo.name() + " is invalid: `"
							+ teamName + "` is not configured as a GitHub team for the `" + repo.org() + "` org");
				}
			}
			for (String individual : repo.access().individuals().keySet()) {
				if (data.person(individual).isEmpty()) {
					throw new ViolationException("access for " + repo.org() + "/" + repo.name() + " is invalid: `"
							+ individual + "` is not the name of a person in the team repo");
				}
			}
		});
	}

}
