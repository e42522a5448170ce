package org.springaicommunity.team.validator;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.springaicommunity.team.validator.CheckSupport.forEach;

/**
 * Checks over the team hierarchy, team membership and per-team integrations.
 */
final class TeamChecks {

	private static final String WORKING_GROUP_PREFIX = "wg-";

	private static final String PROJECT_GROUP_PREFIX = "project-";

	private TeamChecks() {
	}

	/**
	 * Working groups must be named {@code wg-*} and project groups {@code project-*};
	 * other kinds must not use those prefixes. Each exemption only applies to its own kind.
	 */
	static void validateNamePrefixes(TeamData data, ValidationErrors errors) {
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			ensurePrefix(team, TeamKind.WORKING_GROUP, WORKING_GROUP_PREFIX, Set.of("wg-leads"));
			ensurePrefix(team, TeamKind.PROJECT_GROUP, PROJECT_GROUP_PREFIX, Set.of("project-group-leads"));
		});
	}

	private static void ensurePrefix(Team team, TeamKind kind, String prefix, Set<String> exemptions)
			throws ViolationException {
		if (exemptions.contains(team.name())) {
			return;
		}
		boolean hasPrefix = team.name().startsWith(prefix);
		if (team.kind() == kind && !hasPrefix) {
			throw new ViolationException(kind + " `" + team.name() + "`'s name doesn't start with `" + prefix + "`");
		}
		if (team.kind() != kind && hasPrefix) {
			throw new ViolationException(team.kind() + " `" + team.name() + "` seems like a " + kind
					+ " (since it has the `" + prefix + "` prefix)");
		}
	}

	/**
	 * Walk each team's parent chain: parents must exist, the chain must not loop, and only
	 * teams of kind {@link TeamKind#TEAM} may sit below a subteam. A loop is reported once,
	 * starting from its lexicographically smallest member, and suppresses the nesting
	 * violations of the teams on it.
	 */
	static void validateSubteamOf(TeamData data, ValidationErrors errors) {
		Set<String> reportedCycles = new HashSet<>();
		forEach(data.teams(), errors, (Team start, ValidationErrors e) -> {
			String cycle = findCycle(data, start);
			if (cycle != null) {
				if (reportedCycles.add(cycle)) {
					e.add(cycle);
				}
				return;
			}

			List<String> visited = new ArrayList<>();
			Team team = start;
			while (team.subteamOf() != null) {
				String parentName = team.subteamOf();
				visited.add(team.name());

				Team parent = data.team(parentName)
					.orElseThrow(() -> new ViolationException("the parent of team `" + visitedLast(visited)
							+ "` doesn't exist: `" + parentName + "`"));

				if (team.kind() != TeamKind.TEAM && parent.subteamOf() != null) {
					throw new ViolationException(team.kind() + " `" + team.name()
							+ "` can't be a subteam of a subteam (`" + parent.name() + "`)");
				}
				team = parent;
			}
		});
	}

	private static @Nullable String findCycle(TeamData data, Team start) {
		List<String> visited = new ArrayList<>();
		Team team = start;
		while (team.subteamOf() != null) {
			String parentName = team.subteamOf();
			visited.add(team.name());

			int loopStart = visited.indexOf(parentName);
			if (loopStart >= 0) {
				return describeCycle(visited.subList(loopStart, visited.size()));
			}
			Optional<Team> parent = data.team(parentName);
			if (parent.isEmpty()) {
				return null;
			}
			team = parent.get();
		}
		return null;
	}

	private static String visitedLast(List<String> visited) {
		return visited.get(visited.size() - 1);
	}

	private static String describeCycle(List<String> loop) {
		int first = 0;
		for (int i = 1; i < loop.size(); i++) {
			if (loop.get(i).compareTo(loop.get(first)) < 0) {
				first = i;
			}
		}
		List<String> path = new ArrayList<>(loop.subList(first, loop.size()));
		path.addAll(loop.subList(0, first));
		String head = path.get(0);
		return "team `" + head + "` is a subteam of itself: " + String.join(" => ", path) + " => " + head;
	}

	/**
	 * Every lead must be an effective member of the team they lead.
	 */
	static void validateTeamLeads(TeamData data, ValidationErrors errors) {
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			Set<String> members = data.effectiveMembers(team);
			forEach(team.leads(), e, (String lead, ValidationErrors inner) -> {
				if (!members.contains(lead)) {
					throw new ViolationException(
							"`" + lead + "` leads team `" + team.name() + "`, but is not a member of it");
				}
			});
		});
	}

	/**
	 * Every effective member must be a known person.
	 */
	static void validateTeamMembers(TeamData data, ValidationErrors errors) {
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			forEach(data.effectiveMembers(team), e, (String member, ValidationErrors inner) -> {
				if (data.person(member).isEmpty()) {
					throw new ViolationException(
							"person `" + member + "` is member of team `" + team.name() + "` but doesn't exist");
				}
			});
		});
	}

	/**
	 * Members of the alumni team must not be active anywhere, and the alumni team must not
	 * explicitly list somebody already recorded as alumni of another team.
	 */
	static void validateAlumni(TeamData data, ValidationErrors errors) {
		Set<String> active;
		try {
			active = data.activeMembers();
		}
		catch (TeamDataException ex) {
			errors.add(ex.getMessage());
			return;
		}
		forEach(data.team(TeamData.ALUMNI_TEAM).stream().toList(), errors, (Team alumniTeam, ValidationErrors e) -> {
			forEach(data.effectiveMembers(alumniTeam), e, (String member, ValidationErrors inner) -> {
				if (active.contains(member)) {
					throw new ViolationException("alumni team includes active member `" + member + "`");
				}
			});

			Set<String> explicitMembers = new HashSet<>(alumniTeam.explicitMembers());
			List<Map.Entry<String, String>> listedAlumni = new ArrayList<>();
			for (Team team : data.teams()) {
				if (!TeamData.ALUMNI_TEAM.equals(team.name())) {
					team.alumni().forEach(member -> listedAlumni.add(Map.entry(team.name(), member)));
				}
			}
			forEach(listedAlumni, e, (Map.Entry<String, String> entry, ValidationErrors inner) -> {
				if (explicitMembers.remove(entry.getValue())) {
					throw new ViolationException("alumni team explicitly includes member `" + entry.getValue()
							+ "` who was specified as an alumni already in `" + entry.getKey() + "`");
				}
			});
		});
	}

	/**
	 * rfcbot labels must be unique across teams.
	 */
	static void validateRfcbotLabels(TeamData data, ValidationErrors errors) {
		Set<String> labels = new HashSet<>();
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			RfcbotData rfcbot = team.rfcbot();
			if (rfcbot != null && !labels.add(rfcbot.label())) {
				e.add("duplicate rfcbot label: " + rfcbot.label());
			}
		});
	}

	/**
	 * rfcbot exclude-lists must not repeat a person and may only name team members.
	 */
	static void validateRfcbotExcludeMembers(TeamData data, ValidationErrors errors) {
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			RfcbotData rfcbot = team.rfcbot();
			if (rfcbot == null) {
				return;
			}
			Set<String> members = data.effectiveMembers(team);
			Set<String> seen = new HashSet<>();
			forEach(rfcbot.excludeMembers(), e, (String member, ValidationErrors inner) -> {
				if (!seen.add(member)) {
					throw new ViolationException(
							"duplicate member in `" + team.name() + "` rfcbot.exclude-members: " + member);
				}
				if (!members.contains(member)) {
					throw new ViolationException("person `" + member + "` is not a member of team `" + team.name()
							+ "` (in rfcbot.exclude-members)");
				}
			});
		});
	}

	/**
	 * Team names may only contain alphanumeric characters and dashes.
	 */
	static void validateTeamNames(TeamData data, ValidationErrors errors) {
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			boolean valid = team.name().chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '-');
			if (!valid) {
				throw new ViolationException(
						"team name `" + team.name() + "` can only be alphanumeric with dashes");
			}
		});
	}

	/**
	 * Code-host teams must live in an allowed organization and be claimed by one team only.
	 */
	static void validateGithubTeams(TeamData data, ValidationErrors errors) {
		Set<String> allowed = data.config().allowedGithubOrgs();
		Map<GitHubTeamMapping, String> claimedBy = new HashMap<>();
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			forEach(data.githubTeams(team), e, (GitHubTeam githubTeam, ValidationErrors inner) -> {
				if (!allowed.contains(githubTeam.org())) {
					throw new ViolationException("GitHub organization `" + githubTeam.org()
							+ "` isn't allowed (in team `" + team.name() + "`)");
				}
				String other = claimedBy.put(githubTeam.key(), team.name());
				if (other != null) {
					throw new ViolationException("GitHub team `" + githubTeam.key() + "` is defined for both the `"
							+ team.name() + "` and `" + other + "` teams");
				}
			});
		});
	}

	/**
	 * The Zulip stream of a team is a stream name, not a link.
	 */
	static void validateZulipStreamName(TeamData data, ValidationErrors errors) {
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			TeamWebsite website = team.website();
			String stream = website != null ? website.zulipStream() : null;
			if (stream != null && stream.startsWith("https://")) {
				throw new ViolationException("the zulip stream name of the team `" + team.name()
						+ "` is a link: only the name is required");
			}
		});
	}

	/**
	 * Every project group needs a parent team.
	 */
	static void validateProjectGroupsHaveParentTeams(TeamData data, ValidationErrors errors) {
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			if (team.kind() == TeamKind.PROJECT_GROUP && team.subteamOf() == null) {
				throw new ViolationException("the project group `" + team.name()
						+ "` doesn't have a parent team, but it's required to have one");
			}
		});
	}

	/**
	 * Members of a team bound to at least one Discord role need a Discord id. The "all"
	 * team is exempt, and so is a team whose role list is empty.
	 */
	static void validateDiscordTeamMembersHaveDiscordIds(TeamData data, ValidationErrors errors) {
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			if (team.discordRoles().isEmpty() || TeamData.ALL_TEAM.equals(team.name())) {
				return;
			}
			List<String> missing = new ArrayList<>();
			for (String member : data.effectiveMembers(team)) {
				data.person(member).filter(person -> person.discordId() == null).ifPresent(p -> missing.add(member));
			}
			if (!missing.isEmpty()) {
				throw new ViolationException("the following members of the \"" + team.name()
						+ "\" team do not have discord_ids: " + String.join(", ", missing));
			}
		});
	}

}
