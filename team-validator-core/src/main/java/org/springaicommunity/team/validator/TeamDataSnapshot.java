package org.springaicommunity.team.validator;

import java.util.List;

/**
 * JSON interchange form of the team data, as read by {@link TeamDataLoader}.
 *
 * @param config repository-wide configuration
 * @param people every known person
 * @param teams active teams
 * @param archivedTeams archived teams
 * @param repos managed repositories
 */
public record TeamDataSnapshot(TeamConfig config, List<Person> people, List<Team> teams, List<Team> archivedTeams,
		List<Repo> repos) {

	public TeamDataSnapshot {
		config = config == null ? TeamConfig.empty() : config;
		people = people == null ? List.of() : List.copyOf(people);
		teams = teams == null ? List.of() : List.copyOf(teams);
		archivedTeams = archivedTeams == null ? List.of() : List.copyOf(archivedTeams);
		repos = repos == null ? List.of() : List.copyOf(repos);
	}

	public InMemoryTeamData toTeamData() {
		return new InMemoryTeamData(config, people, teams, archivedTeams, repos);
	}

}
