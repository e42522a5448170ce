package org.springaicommunity.team.validator;

import java.util.List;

/**
 * Membership declaration of a team.
 *
 * <p>
 * Only {@code members}, {@code leads} and {@code alumni} name people directly. The
 * remaining fields fold in people from other teams when the effective membership is
 * resolved, see {@link TeamData#effectiveMembers(Team)}.
 *
 * @param members explicit members by GitHub handle
 * @param leads team leads by GitHub handle
 * @param alumni former members by GitHub handle
 * @param includedTeams teams whose effective members are also members of this team
 * @param includeTeamLeads include the leads of every team of kind {@link TeamKind#TEAM}
 * @param includeWorkingGroupLeads include the leads of every working group
 * @param includeProjectGroupLeads include the leads of every project group
 * @param includeAllTeamMembers include the explicit members of every team of kind
 * {@link TeamKind#TEAM}
 * @param includeAllAlumni include the alumni of every team
 */
public record TeamPeople(List<String> members, List<String> leads, List<String> alumni, List<String> includedTeams,
		boolean includeTeamLeads, boolean includeWorkingGroupLeads, boolean includeProjectGroupLeads,
		boolean includeAllTeamMembers, boolean includeAllAlumni) {

	public TeamPeople {
		members = members == null ? List.of() : List.copyOf(members);
		leads = leads == null ? List.of() : List.copyOf(leads);
		alumni = alumni == null ? List.of() : List.copyOf(alumni);
		includedTeams = includedTeams == null ? List.of() : List.copyOf(includedTeams);
	}

	public TeamPeople(List<String> members, List<String> leads, List<String> alumni) {
		this(members, leads, alumni, List.of(), false, false, false, false, false);
	}

	public static TeamPeople empty() {
		return new TeamPeople(List.of(), List.of(), List.of());
	}

}
