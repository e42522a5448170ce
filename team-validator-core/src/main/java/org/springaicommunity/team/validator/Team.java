package org.springaicommunity.team.validator;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A team, working group, project group or marker team.
 *
 * <p>
 * Teams form a leaf-to-root hierarchy through {@link #subteamOf()}. Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * Team compiler = Team.builder("compiler")
 *     .members("alice", "bob")
 *     .leads("alice")
 *     .githubTeam("rust-lang", "compiler")
 *     .build();
 * }
 * </pre>
 *
 * @param name unique team name
 * @param kind the team kind
 * @param subteamOf name of the parent team, if any
 * @param people membership declaration
 * @param githubTeams code-host teams the team is mirrored to
 * @param website optional website metadata
 * @param discordRoles Discord roles bound to the team
 * @param zulipGroups Zulip user groups declared by the team
 * @param lists mailing lists bound to the team
 * @param permissions capabilities granted to every member
 * @param leadsPermissions capabilities granted to the leads only
 * @param rfcbot optional rfcbot integration settings
 */
public record Team(String name, TeamKind kind, @Nullable String subteamOf, TeamPeople people,
		List<GitHubTeamMapping> githubTeams, @Nullable TeamWebsite website, List<DiscordRole> discordRoles,
		List<TeamZulipGroup> zulipGroups, List<TeamList> lists, Permissions permissions,
		Permissions leadsPermissions, @Nullable RfcbotData rfcbot) {

	public Team {
		Objects.requireNonNull(name, "team name is required");
		kind = kind == null ? TeamKind.TEAM : kind;
		people = people == null ? TeamPeople.empty() : people;
		githubTeams = githubTeams == null ? List.of() : List.copyOf(githubTeams);
		discordRoles = discordRoles == null ? List.of() : List.copyOf(discordRoles);
		zulipGroups = zulipGroups == null ? List.of() : List.copyOf(zulipGroups);
		lists = lists == null ? List.of() : List.copyOf(lists);
		permissions = permissions == null ? Permissions.none() : permissions;
		leadsPermissions = leadsPermissions == null ? Permissions.none() : leadsPermissions;
	}

	/**
	 * Create a builder for a team of kind {@link TeamKind#TEAM}.
	 * @param name the team name
	 * @return new builder
	 */
	public static Builder builder(String name) {
		return new Builder(name);
	}

	public List<String> explicitMembers() {
		return people.members();
	}

	public List<String> leads() {
		return people.leads();
	}

	public List<String> alumni() {
		return people.alumni();
	}

	/**
	 * Builder for {@link Team}.
	 */
	public static final class Builder {

		private final String name;

		private TeamKind kind = TeamKind.TEAM;

		private @Nullable String subteamOf;

		private final List<String> members = new ArrayList<>();

		private final List<String> leads = new ArrayList<>();

		private final List<String> alumni = new ArrayList<>();

		private final List<String> includedTeams = new ArrayList<>();

		private boolean includeTeamLeads;

		private boolean includeWorkingGroupLeads;

		private boolean includeProjectGroupLeads;

		private boolean includeAllTeamMembers;

		private boolean includeAllAlumni;

		private final List<GitHubTeamMapping> githubTeams = new ArrayList<>();

		private @Nullable TeamWebsite website;

		private final List<DiscordRole> discordRoles = new ArrayList<>();

		private final List<TeamZulipGroup> zulipGroups = new ArrayList<>();

		private final List<TeamList> lists = new ArrayList<>();

		private Permissions permissions = Permissions.none();

		private Permissions leadsPermissions = Permissions.none();

		private @Nullable RfcbotData rfcbot;

		private Builder(String name) {
			this.name = name;
		}

		public Builder kind(TeamKind kind) {
			this.kind = kind;
			return this;
		}

		public Builder subteamOf(@Nullable String parent) {
			this.subteamOf = parent;
			return this;
		}

		public Builder members(String... handles) {
			this.members.addAll(List.of(handles));
			return this;
		}

		public Builder leads(String... handles) {
			this.leads.addAll(List.of(handles));
			return this;
		}

		public Builder alumni(String... handles) {
			this.alumni.addAll(List.of(handles));
			return this;
		}

		public Builder includeTeams(String... teams) {
			this.includedTeams.addAll(List.of(teams));
			return this;
		}

		public Builder includeTeamLeads(boolean include) {
			this.includeTeamLeads = include;
			return this;
		}

		public Builder includeWorkingGroupLeads(boolean include) {
			this.includeWorkingGroupLeads = include;
			return this;
		}

		public Builder includeProjectGroupLeads(boolean include) {
			this.includeProjectGroupLeads = include;
			return this;
		}

		public Builder includeAllTeamMembers(boolean include) {
			this.includeAllTeamMembers = include;
			return this;
		}

		public Builder includeAllAlumni(boolean include) {
			this.includeAllAlumni = include;
			return this;
		}

		public Builder githubTeam(String org, String teamName) {
			this.githubTeams.add(new GitHubTeamMapping(org, teamName));
			return this;
		}

		public Builder website(@Nullable TeamWebsite website) {
			this.website = website;
			return this;
		}

		public Builder discordRole(String roleName) {
			this.discordRoles.add(new DiscordRole(roleName, null));
			return this;
		}

		public Builder zulipGroup(TeamZulipGroup group) {
			this.zulipGroups.add(group);
			return this;
		}

		public Builder list(TeamList list) {
			this.lists.add(list);
			return this;
		}

		public Builder permissions(Permissions permissions) {
			this.permissions = permissions;
			return this;
		}

		public Builder leadsPermissions(Permissions leadsPermissions) {
			this.leadsPermissions = leadsPermissions;
			return this;
		}

		public Builder rfcbot(@Nullable RfcbotData rfcbot) {
			this.rfcbot = rfcbot;
			return this;
		}

		public Team build() {
			TeamPeople people = new TeamPeople(members, leads, alumni, includedTeams, includeTeamLeads,
					includeWorkingGroupLeads, includeProjectGroupLeads, includeAllTeamMembers, includeAllAlumni);
			return new Team(name, kind, subteamOf, people, githubTeams, website, discordRoles, zulipGroups, lists,
					permissions, leadsPermissions, rfcbot);
		}

	}

}
