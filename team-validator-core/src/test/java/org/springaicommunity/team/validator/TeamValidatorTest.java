package org.springaicommunity.team.validator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springaicommunity.team.validator.TestData.data;
import static org.springaicommunity.team.validator.TestData.person;

/**
 * Tests for {@link TeamValidator}: tier ordering, directory availability, skipping and
 * the aggregated report.
 */
@DisplayName("TeamValidator Tests")
@ExtendWith(MockitoExtension.class)
class TeamValidatorTest {

	@Mock
	private GitHubDirectory github;

	@Mock
	private ZulipDirectory zulip;

	private TeamData valid;

	@BeforeEach
	void setUp() {
		valid = data().person(person("alice", 1).withZulipId(10L))
			.team(Team.builder("core").members("alice").leads("alice").zulipGroup(new TeamZulipGroup("T-core")).build())
			.build();
	}

	private static NamedCheck<LocalCheck> failing(String name, String... messages) {
		return NamedCheck.of(name, (data, errors) -> {
			for (String message : messages) {
				errors.add(message);
			}
		});
	}

	@Nested
	@DisplayName("Default Registry Tests")
	class DefaultRegistryTest {

		@Test
		@DisplayName("Should pass valid data with both directories available")
		void shouldPassValidData() throws Exception {
			when(github.usernames(anyCollection())).thenReturn(Map.of(1L, "alice"));
			when(zulip.getUsers()).thenReturn(List.of(new ZulipUser(10L, "alice@example.com", "Alice")));

			new TeamValidator(github, zulip).validate(valid, false, Set.of());

			verify(github).requireAuth();
			verify(zulip).requireAuth();
		}

		@Test
		@DisplayName("Should report sorted violations from every tier")
		void shouldReportSortedViolations() throws Exception {
			TeamData teamData = data().person(person("alice", 1))
				.team(Team.builder("core").members("alice", "ghost").leads("bob").build())
				.build();
			when(github.usernames(anyCollection())).thenReturn(Map.of(1L, "alicia"));
			when(zulip.getUsers()).thenReturn(List.of());

			assertThatThrownBy(() -> new TeamValidator(github, zulip).validate(teamData, false, Set.of()))
				.hasMessage("3 validation errors found")
				.isInstanceOfSatisfying(ValidationFailedException.class,
						ex -> assertThat(ex.errors()).containsExactly(
								"`bob` leads team `core`, but is not a member of it",
								"person `ghost` is member of team `core` but doesn't exist",
								"user `alice` changed username to `alicia`"));
		}

		@Test
		@DisplayName("Should not run skipped checks")
		void shouldSkipNamedChecks() throws Exception {
			TeamData teamData = data().team(Team.builder("bad_name").build()).build();
			when(zulip.getUsers()).thenReturn(List.of());

			new TeamValidator(github, zulip).validate(teamData, false, Set.of("team-names", "github-usernames"));

			verify(github, never()).usernames(anyCollection());
		}

	}

	@Nested
	@DisplayName("Directory Availability Tests")
	class AvailabilityTest {

		@Test
		@DisplayName("Should skip the GitHub tier when unavailable outside strict mode")
		void shouldSkipGitHubTier() throws Exception {
			doThrow(new DirectoryException("missing environment variable GITHUB_TOKEN")).when(github).requireAuth();
			when(zulip.getUsers()).thenReturn(List.of(new ZulipUser(10L, null, null)));

			new TeamValidator(github, zulip).validate(valid, false, Set.of());

			verify(github, never()).usernames(anyCollection());
			verify(zulip).getUsers();
		}

		@Test
		@DisplayName("Should abort in strict mode before probing Zulip")
		void shouldAbortInStrictMode() throws Exception {
			doThrow(new DirectoryException("the GitHub token is not valid")).when(github).requireAuth();

			assertThatThrownBy(() -> new TeamValidator(github, zulip).validate(valid, true, Set.of()))
				.isInstanceOf(DirectoryException.class)
				.hasMessage("the GitHub token is not valid");

			verifyNoInteractions(zulip);
		}

		@Test
		@DisplayName("Should never fail the run because Zulip is unavailable")
		void shouldTolerateMissingZulip() throws Exception {
			when(github.usernames(anyCollection())).thenReturn(Map.of(1L, "alice"));
			doThrow(new DirectoryException("missing ZULIP_USERNAME and/or ZULIP_TOKEN environment variables")).when(zulip)
				.requireAuth();

			new TeamValidator(github, zulip).validate(valid, true, Set.of());

			verify(zulip, never()).getUsers();
		}

	}

	@Nested
	@DisplayName("Custom Registry Tests")
	class CustomRegistryTest {

		@Test
		@DisplayName("Should deduplicate messages reported by several checks")
		void shouldDeduplicate() {
			CheckRegistry registry = new CheckRegistry(List.of(failing("one", "b", "a"), failing("two", "a")),
					List.of(), List.of());

			assertThatThrownBy(() -> new TeamValidator(github, zulip, registry).validate(valid, false, Set.of()))
				.isInstanceOfSatisfying(ValidationFailedException.class,
						ex -> assertThat(ex.errors()).containsExactly("a", "b"));
		}

		@Test
		@DisplayName("Should produce the same report whatever the check order")
		void shouldNotDependOnCheckOrder() {
			NamedCheck<LocalCheck> first = failing("first", "z", "m");
			NamedCheck<LocalCheck> second = failing("second", "a");
			TeamValidator forward = new TeamValidator(github, zulip,
					new CheckRegistry(List.of(first, second), List.of(), List.of()));
			TeamValidator backward = new TeamValidator(github, zulip,
					new CheckRegistry(List.of(second, first), List.of(), List.of()));

			ValidationFailedException a = catchThrowableOfType(() -> forward.validate(valid, false, Set.of()),
					ValidationFailedException.class);
			ValidationFailedException b = catchThrowableOfType(() -> backward.validate(valid, false, Set.of()),
					ValidationFailedException.class);

			assertThat(a.errors()).isEqualTo(b.errors()).containsExactly("a", "m", "z");
		}

		@Test
		@DisplayName("Should keep earlier violations when a check throws")
		void shouldReportThrowingCheck() {
			NamedCheck<LocalCheck> broken = NamedCheck.of("broken", (data, errors) -> {
				throw new IllegalStateException("boom");
			});
			CheckRegistry registry = new CheckRegistry(List.of(failing("one", "first"), broken, failing("three", "last")),
					List.of(), List.of());

			assertThatThrownBy(() -> new TeamValidator(github, zulip, registry).validate(valid, false, Set.of()))
				.isInstanceOfSatisfying(ValidationFailedException.class, ex -> assertThat(ex.errors())
					.containsExactly("check `broken` failed: boom", "first", "last"));
		}

		@Test
		@DisplayName("Should expose check names in registration order")
		void shouldListNames() {
			assertThat(CheckRegistry.defaults().names()).startsWith("name-prefixes", "subteam-of")
				.endsWith("repos", "github-usernames", "zulip-users")
				.hasSize(25);
		}

	}

}
