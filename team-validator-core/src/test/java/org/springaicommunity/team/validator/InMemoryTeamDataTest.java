package org.springaicommunity.team.validator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.springaicommunity.team.validator.TestData.data;
import static org.springaicommunity.team.validator.TestData.person;

/**
 * Tests for membership resolution and the derived views of {@link InMemoryTeamData}.
 */
@DisplayName("InMemoryTeamData Tests")
class InMemoryTeamDataTest {

	@Nested
	@DisplayName("Effective Membership Tests")
	class EffectiveMembersTest {

		@Test
		@DisplayName("Should fold in included teams transitively")
		void shouldIncludeTeamsTransitively() throws Exception {
			InMemoryTeamData teamData = data().team(Team.builder("a").members("alice").includeTeams("b").build())
				.team(Team.builder("b").members("bob").includeTeams("c").build())
				.team(Team.builder("c").members("carol").build())
				.build();

			assertThat(teamData.effectiveMembers(teamData.team("a").orElseThrow())).containsExactly("alice", "bob",
					"carol");
		}

		@Test
		@DisplayName("Should report an inclusion cycle with its path")
		void shouldReportInclusionCycle() {
			InMemoryTeamData teamData = data().team(Team.builder("a").includeTeams("b").build())
				.team(Team.builder("b").includeTeams("a").build())
				.build();

			assertThatThrownBy(() -> teamData.effectiveMembers(teamData.team("a").orElseThrow()))
				.isInstanceOf(TeamDataException.class)
				.hasMessage("team `a` includes itself: a => b => a");
		}

		@Test
		@DisplayName("Should include leads by team kind")
		void shouldIncludeLeadsByKind() throws Exception {
			InMemoryTeamData teamData = data().team(Team.builder("leads").includeWorkingGroupLeads(true).build())
				.team(Team.builder("core").members("alice").leads("alice").build())
				.team(Team.builder("wg-x").kind(TeamKind.WORKING_GROUP).members("bob").leads("bob").build())
				.build();

			assertThat(teamData.effectiveMembers(teamData.team("leads").orElseThrow())).containsExactly("bob");
		}

		@Test
		@DisplayName("Should include all team members except the alumni team and itself")
		void shouldIncludeAllTeamMembers() throws Exception {
			InMemoryTeamData teamData = data().team(Team.builder("all").members("zed").includeAllTeamMembers(true).build())
				.team(Team.builder("core").members("alice").build())
				.team(Team.builder("wg-x").kind(TeamKind.WORKING_GROUP).members("bob").build())
				.team(Team.builder("alumni").members("old").build())
				.build();

			assertThat(teamData.effectiveMembers(teamData.team("all").orElseThrow())).containsExactly("alice", "zed");
		}

		@Test
		@DisplayName("Should include alumni of active and archived teams")
		void shouldIncludeAllAlumni() throws Exception {
			InMemoryTeamData teamData = data().team(Team.builder("alumni").includeAllAlumni(true).build())
				.team(Team.builder("core").members("alice").alumni("bob").build())
				.archivedTeam(Team.builder("gone").members("carol").alumni("dave").build())
				.build();

			assertThat(teamData.effectiveMembers(teamData.team("alumni").orElseThrow())).containsExactly("bob",
					"carol", "dave");
			assertThat(teamData.activeMembers()).containsExactly("alice");
		}

		@Test
		@DisplayName("Should reject duplicate team names")
		void shouldRejectDuplicateTeams() {
			assertThatIllegalArgumentException()
				.isThrownBy(() -> data().team(Team.builder("a").build()).team(Team.builder("a").build()).build())
				.withMessage("duplicate team `a`");
		}

	}

	@Nested
	@DisplayName("Derived View Tests")
	class DerivedViewTest {

		@Test
		@DisplayName("Should resolve GitHub teams to member ids")
		void shouldResolveGitHubTeams() throws Exception {
			InMemoryTeamData teamData = data().person(person("alice", 7))
				.person(person("bob", 3))
				.team(Team.builder("core").members("alice", "bob").githubTeam("rust-lang", "core").build())
				.build();

			assertThat(teamData.githubTeams(teamData.team("core").orElseThrow()))
				.containsExactly(new GitHubTeam("rust-lang", "core", List.of(3L, 7L)));
			assertThat(teamData.githubTeamKeys()).containsExactly(new GitHubTeamMapping("rust-lang", "core"));
		}

		@Test
		@DisplayName("Should reject GitHub teams with unknown members")
		void shouldRejectUnknownGitHubMember() {
			InMemoryTeamData teamData = data()
				.team(Team.builder("core").members("ghost").githubTeam("rust-lang", "core").build())
				.build();

			assertThatThrownBy(() -> teamData.githubTeams(teamData.team("core").orElseThrow()))
				.isInstanceOf(TeamDataException.class)
				.hasMessage("person `ghost` is a member of team `core`, but their GitHub id is unknown");
		}

		@Test
		@DisplayName("Should compute mailing list subscribers")
		void shouldComputeMailingLists() throws Exception {
			InMemoryTeamData teamData = data().team(Team.builder("core")
				.members("alice")
				.list(new TeamList("core@rust-lang.org", List.of("bob"), List.of("infra")))
				.build()).team(Team.builder("infra").members("carol").build()).build();

			assertThat(teamData.mailingLists(teamData.team("core").orElseThrow()))
				.isEqualTo(Map.of("core@rust-lang.org", Set.of("alice", "bob", "carol")));
		}

		@Test
		@DisplayName("Should resolve Zulip group members by shape")
		void shouldResolveZulipGroups() throws Exception {
			InMemoryTeamData teamData = data().person(person("alice", 1).withZulipId(10L))
				.person(person("bob", 2))
				.person(person("carol", 3))
				.team(Team.builder("core")
					.members("alice", "bob", "carol")
					.zulipGroup(new TeamZulipGroup("T-core", true, List.of(), List.of(42L), List.of("carol")))
					.build())
				.build();

			ZulipGroup group = teamData.zulipGroups().get("T-core");

			assertThat(group.members()).containsExactly(ZulipGroupMember.withId("alice", 10L),
					ZulipGroupMember.withoutId("bob"), ZulipGroupMember.justId(42L));
		}

	}

}
