package org.springaicommunity.team.validator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * {@link TeamData} backed by fully materialized entity lists.
 *
 * <p>
 * Instances are immutable. Effective memberships are resolved on every call; the data
 * set is small enough that caching is not needed.
 */
public final class InMemoryTeamData implements TeamData {

	private final TeamConfig config;

	private final Map<String, Person> people;

	private final Map<String, Team> teams;

	private final List<Team> archivedTeams;

	private final List<Repo> repos;

	public InMemoryTeamData(TeamConfig config, List<Person> people, List<Team> teams, List<Team> archivedTeams,
			List<Repo> repos) {
		this.config = config;
		this.people = index(people, Person::github, "person");
		this.teams = index(teams, Team::name, "team");
		this.archivedTeams = List.copyOf(archivedTeams);
		this.repos = List.copyOf(repos);
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public Optional<Team> team(String name) {
		return Optional.ofNullable(teams.get(name));
	}

	@Override
	public Optional<Person> person(String github) {
		return Optional.ofNullable(people.get(github));
	}

	@Override
	public List<Team> teams() {
		return List.copyOf(teams.values());
	}

	@Override
	public List<Team> archivedTeams() {
		return archivedTeams;
	}

	@Override
	public List<Person> people() {
		return List.copyOf(people.values());
	}

	@Override
	public List<Repo> repos() {
		return repos;
	}

	@Override
	public TeamConfig config() {
		return config;
	}

	@Override
	public Set<String> effectiveMembers(Team team) throws TeamDataException {
		return Collections.unmodifiableSet(resolveMembers(team, new ArrayDeque<>()));
	}

	private Set<String> resolveMembers(Team team, Deque<String> path) throws TeamDataException {
		if (path.contains(team.name())) {
			List<String> cycle = new ArrayList<>(path);
			Collections.reverse(cycle);
			throw new TeamDataException("team `" + team.name() + "` includes itself: " + String.join(" => ", cycle)
					+ " => " + team.name());
		}
		path.push(team.name());

		TeamPeople declared = team.people();
		Set<String> members = new TreeSet<>(declared.members());
		for (Team other : teams.values()) {
			if ((declared.includeTeamLeads() && other.kind() == TeamKind.TEAM)
					|| (declared.includeWorkingGroupLeads() && other.kind() == TeamKind.WORKING_GROUP)
					|| (declared.includeProjectGroupLeads() && other.kind() == TeamKind.PROJECT_GROUP)) {
				members.addAll(other.leads());
			}
			if (declared.includeAllTeamMembers() && other.kind() == TeamKind.TEAM && other != team
					&& !ALUMNI_TEAM.equals(other.name()) && !other.people().includeAllTeamMembers()) {
				members.addAll(other.explicitMembers());
			}
			if (declared.includeAllAlumni() && other != team) {
				members.addAll(other.alumni());
			}
		}
		if (declared.includeAllAlumni()) {
			for (Team archived : archivedTeams) {
				members.addAll(archived.explicitMembers());
				members.addAll(archived.alumni());
			}
		}
		for (String included : declared.includedTeams()) {
			Team includedTeam = teams.get(included);
			if (includedTeam == null) {
				throw new TeamDataException(
						"team `" + team.name() + "` includes the members of `" + included + "`, which doesn't exist");
			}
			members.addAll(resolveMembers(includedTeam, path));
		}

		path.pop();
		return members;
	}

	@Override
	public Set<String> activeMembers() throws TeamDataException {
		Set<String> active = new TreeSet<>();
		for (Team team : teams.values()) {
			if (!ALUMNI_TEAM.equals(team.name())) {
				active.addAll(effectiveMembers(team));
			}
		}
		return Collections.unmodifiableSet(active);
	}

	@Override
	public List<GitHubTeam> githubTeams(Team team) throws TeamDataException {
		if (team.githubTeams().isEmpty()) {
			return List.of();
		}
		Set<Long> ids = new TreeSet<>();
		for (String member : effectiveMembers(team)) {
			Person person = people.get(member);
			if (person == null) {
				throw new TeamDataException("person `" + member + "` is a member of team `" + team.name()
						+ "`, but their GitHub id is unknown");
			}
			ids.add(person.githubId());
		}
		List<GitHubTeam> resolved = new ArrayList<>();
		for (GitHubTeamMapping mapping : team.githubTeams()) {
			resolved.add(new GitHubTeam(mapping.org(), mapping.name(), List.copyOf(ids)));
		}
		return resolved;
	}

	@Override
	public Set<GitHubTeamMapping> githubTeamKeys() {
		Set<GitHubTeamMapping> keys = new LinkedHashSet<>();
		for (Team team : teams.values()) {
			keys.addAll(team.githubTeams());
		}
		return keys;
	}

	@Override
	public Map<String, Set<String>> mailingLists(Team team) throws TeamDataException {
		Map<String, Set<String>> lists = new LinkedHashMap<>();
		if (team.lists().isEmpty()) {
			return lists;
		}
		Set<String> teamMembers = effectiveMembers(team);
		for (TeamList list : team.lists()) {
			Set<String> subscribers = new TreeSet<>(teamMembers);
			subscribers.addAll(list.extraPeople());
			for (String extraTeam : list.extraTeams()) {
				Team other = teams.get(extraTeam);
				if (other == null) {
					throw new TeamDataException(
							"team `" + extraTeam + "` does not exist (in list `" + list.address() + "`)");
				}
				subscribers.addAll(effectiveMembers(other));
			}
			lists.put(list.address(), Collections.unmodifiableSet(subscribers));
		}
		return lists;
	}

	@Override
	public Map<String, ZulipGroup> zulipGroups() throws TeamDataException {
		Map<String, ZulipGroup> groups = new LinkedHashMap<>();
		for (Team team : teams.values()) {
			for (TeamZulipGroup declared : team.zulipGroups()) {
				if (groups.containsKey(declared.name())) {
					throw new TeamDataException("Zulip group `" + declared.name() + "` is defined twice");
				}
				Set<String> handles = new LinkedHashSet<>();
				if (declared.includeTeamMembers()) {
					handles.addAll(effectiveMembers(team));
				}
				handles.addAll(declared.extraPeople());
				declared.excludedPeople().forEach(handles::remove);

				List<ZulipGroupMember> members = new ArrayList<>();
				for (String handle : handles) {
					Person person = people.get(handle);
					if (person == null) {
						throw new TeamDataException(
								"person `" + handle + "` does not exist (in Zulip group `" + declared.name() + "`)");
					}
					Long zulipId = person.zulipId();
					members.add(zulipId != null ? ZulipGroupMember.withId(handle, zulipId)
							: ZulipGroupMember.withoutId(handle));
				}
				for (Long zulipId : declared.extraZulipIds()) {
					members.add(ZulipGroupMember.justId(zulipId));
				}
				groups.put(declared.name(), new ZulipGroup(declared.name(), members));
			}
		}
		return groups;
	}

	private static <T> Map<String, T> index(List<T> items, Function<T, String> key,
			String kind) {
		Map<String, T> indexed = new LinkedHashMap<>();
		for (T item : items) {
			if (indexed.putIfAbsent(key.apply(item), item) != null) {
				throw new IllegalArgumentException("duplicate " + kind + " `" + key.apply(item) + "`");
			}
		}
		return Collections.unmodifiableMap(indexed);
	}

	/**
	 * Builder for {@link InMemoryTeamData}.
	 */
	public static final class Builder {

		private TeamConfig config = TeamConfig.empty();

		private final List<Person> people = new ArrayList<>();

		private final List<Team> teams = new ArrayList<>();

		private final List<Team> archivedTeams = new ArrayList<>();

		private final List<Repo> repos = new ArrayList<>();

		private Builder() {
		}

		public Builder config(TeamConfig config) {
			this.config = config;
			return this;
		}

		public Builder person(Person person) {
			this.people.add(person);
			return this;
		}

		public Builder team(Team team) {
			this.teams.add(team);
			return this;
		}

		public Builder archivedTeam(Team team) {
			this.archivedTeams.add(team);
			return this;
		}

		public Builder repo(Repo repo) {
			this.repos.add(repo);
			return this;
		}

		public InMemoryTeamData build() {
			return new InMemoryTeamData(config, people, teams, archivedTeams, repos);
		}

	}

}
