package org.springaicommunity.team.validator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered tables of the checks run by {@link TeamValidator}, one per tier.
 *
 * <p>
 * Local checks only read the team data. GitHub checks additionally need a reachable
 * {@link GitHubDirectory}; Zulip checks a reachable {@link ZulipDirectory}. Check names
 * are stable and are what {@code --skip} matches against.
 */
public final class CheckRegistry {

	private static final CheckRegistry DEFAULTS = new CheckRegistry(List.of(
			NamedCheck.<LocalCheck>of("name-prefixes", TeamChecks::validateNamePrefixes),
			NamedCheck.<LocalCheck>of("subteam-of", TeamChecks::validateSubteamOf),
			NamedCheck.<LocalCheck>of("team-leads", TeamChecks::validateTeamLeads),
			NamedCheck.<LocalCheck>of("team-members", TeamChecks::validateTeamMembers),
			NamedCheck.<LocalCheck>of("alumni", TeamChecks::validateAlumni),
			NamedCheck.<LocalCheck>of("inactive-members", PeopleChecks::validateInactiveMembers),
			NamedCheck.<LocalCheck>of("list-email-addresses", ListChecks::validateListEmailAddresses),
			NamedCheck.<LocalCheck>of("list-extra-people", ListChecks::validateListExtraPeople),
			NamedCheck.<LocalCheck>of("list-extra-teams", ListChecks::validateListExtraTeams),
			NamedCheck.<LocalCheck>of("list-addresses", ListChecks::validateListAddresses),
			NamedCheck.<LocalCheck>of("people-addresses", PeopleChecks::validatePeopleAddresses),
			NamedCheck.<LocalCheck>of("duplicate-permissions", PeopleChecks::validateDuplicatePermissions),
			NamedCheck.<LocalCheck>of("permissions", PeopleChecks::validatePermissions),
			NamedCheck.<LocalCheck>of("rfcbot-labels", TeamChecks::validateRfcbotLabels),
			NamedCheck.<LocalCheck>of("rfcbot-exclude-members", TeamChecks::validateRfcbotExcludeMembers),
			NamedCheck.<LocalCheck>of("team-names", TeamChecks::validateTeamNames),
			NamedCheck.<LocalCheck>of("github-teams", TeamChecks::validateGithubTeams),
			NamedCheck.<LocalCheck>of("zulip-stream-name", TeamChecks::validateZulipStreamName),
			NamedCheck.<LocalCheck>of("project-groups-have-parent-teams",
					TeamChecks::validateProjectGroupsHaveParentTeams),
			NamedCheck.<LocalCheck>of("discord-team-members-have-discord-ids",
					TeamChecks::validateDiscordTeamMembersHaveDiscordIds),
			NamedCheck.<LocalCheck>of("zulip-group-ids", ZulipChecks::validateZulipGroupIds),
			NamedCheck.<LocalCheck>of("zulip-group-extra-people", ZulipChecks::validateZulipGroupExtraPeople),
			NamedCheck.<LocalCheck>of("repos", RepoChecks::validateRepos)),
			List.of(NamedCheck.<GitHubCheck>of("github-usernames", PeopleChecks::validateGithubUsernames)),
			List.of(NamedCheck.<ZulipCheck>of("zulip-users", ZulipChecks::validateZulipUsers)));

	private final List<NamedCheck<LocalCheck>> localChecks;

	private final List<NamedCheck<GitHubCheck>> githubChecks;

	private final List<NamedCheck<ZulipCheck>> zulipChecks;

	public CheckRegistry(List<NamedCheck<LocalCheck>> localChecks, List<NamedCheck<GitHubCheck>> githubChecks,
			List<NamedCheck<ZulipCheck>> zulipChecks) {
		this.localChecks = List.copyOf(localChecks);
		this.githubChecks = List.copyOf(githubChecks);
		this.zulipChecks = List.copyOf(zulipChecks);
	}

	/**
	 * Returns the built-in checks in their canonical order.
	 * @return the default registry
	 */
	public static CheckRegistry defaults() {
		return DEFAULTS;
	}

	public List<NamedCheck<LocalCheck>> localChecks() {
		return localChecks;
	}

	public List<NamedCheck<GitHubCheck>> githubChecks() {
		return githubChecks;
	}

	public List<NamedCheck<ZulipCheck>> zulipChecks() {
		return zulipChecks;
	}

	/**
	 * Returns the names of every registered check, tier by tier.
	 * @return check names in run order
	 */
	public Set<String> names() {
		List<String> names = new ArrayList<>();
		localChecks.forEach(check -> names.add(check.name()));
		githubChecks.forEach(check -> names.add(check.name()));
		zulipChecks.forEach(check -> names.add(check.name()));
		return new LinkedHashSet<>(names);
	}

}
