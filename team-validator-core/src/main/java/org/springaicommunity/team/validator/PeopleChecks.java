package org.springaicommunity.team.validator;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

import static org.springaicommunity.team.validator.CheckSupport.forEach;

/**
 * Checks over people: team coverage, contact details, permissions and code-host identity.
 */
final class PeopleChecks {

	private PeopleChecks() {
	}

	/**
	 * A person must be referenced by some team (active or archived), hold a permission, or
	 * be an individual contributor to a repository.
	 */
	static void validateInactiveMembers(TeamData data, ValidationErrors errors) {
		Set<String> referenced = new HashSet<>();
		List<Team> allTeams = Stream.concat(data.teams().stream(), data.archivedTeams().stream()).toList();
		forEach(allTeams, errors, (Team team, ValidationErrors e) -> {
			referenced.addAll(data.effectiveMembers(team));
			referenced.addAll(team.alumni());
			for (TeamList list : team.lists()) {
				referenced.addAll(list.extraPeople());
			}
		});

		Set<String> individualContributors = new HashSet<>();
		for (Repo repo : data.repos()) {
			individualContributors.addAll(repo.access().individuals().keySet());
		}

		List<Person> unreferenced = data.people()
			.stream()
			.filter(person -> !referenced.contains(person.github()))
			.toList();
		forEach(unreferenced, errors, (Person person, ValidationErrors e) -> {
			if (!person.permissions().hasAny() && !individualContributors.contains(person.github())) {
				throw new ViolationException("person `" + person.github()
						+ "` is not a member of any team (active or archived), has no permissions, "
						+ "and is not an individual contributor to any repo");
			}
		});
	}

	/**
	 * Email addresses on file must at least contain an {@code @}.
	 */
	static void validatePeopleAddresses(TeamData data, ValidationErrors errors) {
		forEach(data.people(), errors, (Person person, ValidationErrors e) -> {
			String email = person.email();
			if (person.emailState() == Person.EmailState.PRESENT && email != null && email.indexOf('@') < 0) {
				throw new ViolationException("invalid email address of `" + person.github() + "`: " + email);
			}
		});
	}

	/**
	 * A member of a team must not also hold one of the team's permissions directly. One
	 * violation is reported per person, permission and team.
	 */
	static void validateDuplicatePermissions(TeamData data, ValidationErrors errors) {
		Set<String> available = data.config().availablePermissions();
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			for (String member : data.effectiveMembers(team)) {
				Person person = data.person(member).orElse(null);
				if (person == null) {
					continue;
				}
				for (String permission : available) {
					if (team.permissions().has(permission) && person.permissions().has(permission)) {
						e.add("user `" + member + "` has the permission `" + permission
								+ "` both explicitly and through the `" + team.name() + "` team");
					}
				}
			}
		});
	}

	/**
	 * Every grant on a team, on its leads or on a person must be a configured permission.
	 */
	static void validatePermissions(TeamData data, ValidationErrors errors) {
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			String what = "team `" + team.name() + "`";
			team.permissions().validate(what, data.config());
			team.leadsPermissions().validate(what, data.config());
		});
		forEach(data.people(), errors, (Person person, ValidationErrors e) -> person.permissions()
			.validate("user `" + person.github() + "`", data.config()));
	}

	/**
	 * Every recorded handle must still match the current login of its GitHub account.
	 */
	static void validateGithubUsernames(TeamData data, GitHubDirectory github, ValidationErrors errors) {
		Map<Long, Person> byId = new LinkedHashMap<>();
		for (Person person : data.people()) {
			byId.put(person.githubId(), person);
		}
		Map<Long, String> current;
		try {
			current = github.usernames(byId.keySet());
		}
		catch (DirectoryException ex) {
			errors.add("couldn't verify GitHub usernames: " + ex.getMessage());
			return;
		}
		forEach(new TreeSet<>(current.keySet()), errors, (Long id, ValidationErrors e) -> {
			Person person = byId.get(id);
			String login = current.get(id);
			if (person != null && !person.github().equals(login)) {
				throw new ViolationException("user `" + person.github() + "` changed username to `" + login + "`");
			}
		});
	}

}
