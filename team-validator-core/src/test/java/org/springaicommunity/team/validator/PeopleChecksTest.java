package org.springaicommunity.team.validator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springaicommunity.team.validator.TestData.data;
import static org.springaicommunity.team.validator.TestData.person;
import static org.springaicommunity.team.validator.TestData.run;

/**
 * Tests for the people checks. The GitHub directory is mocked.
 */
@DisplayName("PeopleChecks Tests")
@ExtendWith(MockitoExtension.class)
class PeopleChecksTest {

	private static final String ORPHAN_SUFFIX = "` is not a member of any team (active or archived), has no permissions, "
			+ "and is not an individual contributor to any repo";

	@Mock
	private GitHubDirectory github;

	@Nested
	@DisplayName("Inactive Member Tests")
	class InactiveMembersTest {

		@Test
		@DisplayName("Should report a person without team, permission or repository access")
		void shouldReportOrphan() {
			TeamData teamData = data().person(person("alice", 1))
				.person(person("bob", 2))
				.team(Team.builder("core").members("alice").build())
				.build();

			assertThat(run(PeopleChecks::validateInactiveMembers, teamData)).containsExactly("person `bob" + ORPHAN_SUFFIX);
		}

		@Test
		@DisplayName("Should stop reporting once the person is granted a permission")
		void shouldAcceptPersonWithPermission() {
			TeamData teamData = data().person(person("bob", 2).withPermissions(Permissions.of("perf"))).build();

			assertThat(run(PeopleChecks::validateInactiveMembers, teamData)).isEmpty();
		}

		@Test
		@DisplayName("Should count members, alumni and list extras of archived teams")
		void shouldCountArchivedTeams() {
			TeamData teamData = data().person(person("alice", 1))
				.person(person("bob", 2))
				.person(person("carol", 3))
				.archivedTeam(Team.builder("old")
					.members("alice")
					.alumni("bob")
					.list(new TeamList("old@rust-lang.org", List.of("carol"), List.of()))
					.build())
				.build();

			assertThat(run(PeopleChecks::validateInactiveMembers, teamData)).isEmpty();
		}

		@Test
		@DisplayName("Should accept individual repository contributors")
		void shouldAcceptIndividualContributor() {
			TeamData teamData = data().person(person("bob", 2))
				.repo(new Repo("rust-lang", "rust", new RepoAccess(Map.of(), Map.of("bob", RepoPermission.WRITE))))
				.build();

			assertThat(run(PeopleChecks::validateInactiveMembers, teamData)).isEmpty();
		}

	}

	@Nested
	@DisplayName("Address and Permission Tests")
	class AddressAndPermissionTest {

		@Test
		@DisplayName("Should report an email address without @")
		void shouldReportInvalidEmail() {
			TeamData teamData = data().person(new Person("bob", "Bob", "nope", 2)).build();

			assertThat(run(PeopleChecks::validatePeopleAddresses, teamData))
				.containsExactly("invalid email address of `bob`: nope");
		}

		@Test
		@DisplayName("Should report each permission held both directly and through a team once")
		void shouldReportDuplicatePermissions() {
			TeamData teamData = data().person(person("alice", 1).withPermissions(Permissions.of("perf", "crater")))
				.person(person("bob", 2))
				.team(Team.builder("infra").members("alice", "bob").permissions(Permissions.of("perf", "crater")).build())
				.build();

			assertThat(run(PeopleChecks::validateDuplicatePermissions, teamData)).containsExactlyInAnyOrder(
					"user `alice` has the permission `perf` both explicitly and through the `infra` team",
					"user `alice` has the permission `crater` both explicitly and through the `infra` team");
		}

		@Test
		@DisplayName("Should report unknown grants and review without try")
		void shouldReportInvalidPermissions() {
			TeamData teamData = data().person(person("bob", 2).withPermissions(Permissions.of("bors.rust.review")))
				.team(Team.builder("t").permissions(Permissions.of("unknown")).build())
				.team(Team.builder("u").leadsPermissions(Permissions.of("bors.rust.review", "bors.rust.try")).build())
				.build();

			assertThat(run(PeopleChecks::validatePermissions, teamData)).containsExactly(
					"unknown permission `unknown` for team `t` (maybe add it to the config?)",
					"user `bob` has review permissions but not try on repo rust");
		}

	}

	@Nested
	@DisplayName("GitHub Username Tests")
	class GithubUsernamesTest {

		@Test
		@DisplayName("Should report renamed accounts")
		void shouldReportRenamedAccount() throws DirectoryException {
			TeamData teamData = data().person(person("alice", 1)).person(person("bob", 2)).build();
			when(github.usernames(anyCollection())).thenReturn(Map.of(1L, "alice", 2L, "bobby"));

			ValidationErrors errors = new ValidationErrors();
			PeopleChecks.validateGithubUsernames(teamData, github, errors);

			assertThat(errors.messages()).containsExactly("user `bob` changed username to `bobby`");
		}

		@Test
		@DisplayName("Should turn a directory failure into one violation")
		void shouldReportDirectoryFailure() throws DirectoryException {
			TeamData teamData = data().person(person("alice", 1)).build();
			when(github.usernames(anyCollection())).thenThrow(new DirectoryException("boom"));

			ValidationErrors errors = new ValidationErrors();
			PeopleChecks.validateGithubUsernames(teamData, github, errors);

			assertThat(errors.messages()).containsExactly("couldn't verify GitHub usernames: boom");
		}

	}

}
