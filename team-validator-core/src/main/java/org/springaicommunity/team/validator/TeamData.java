package org.springaicommunity.team.validator;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only query surface over the team data consumed by the validation checks.
 *
 * <p>
 * Derived views that resolve references between entities may fail; those methods throw
 * {@link TeamDataException} instead of returning partial results.
 */
public interface TeamData {

	/**
	 * Name of the team collecting former members.
	 */
	String ALUMNI_TEAM = "alumni";

	/**
	 * Name of the team containing everybody.
	 */
	String ALL_TEAM = "all";

	Optional<Team> team(String name);

	Optional<Person> person(String github);

	/**
	 * Returns the active teams in declaration order.
	 * @return active teams
	 */
	List<Team> teams();

	/**
	 * Returns the archived teams in declaration order.
	 * @return archived teams
	 */
	List<Team> archivedTeams();

	List<Person> people();

	List<Repo> repos();

	TeamConfig config();

	/**
	 * Resolve the effective members of a team: its explicit members plus everybody folded
	 * in through the inclusion settings of {@link TeamPeople}.
	 * @param team the team to resolve
	 * @return GitHub handles, sorted
	 * @throws TeamDataException if an included team does not exist or the inclusions form
	 * a cycle
	 */
	Set<String> effectiveMembers(Team team) throws TeamDataException;

	/**
	 * Union of the effective members of every active team except the alumni team.
	 * @return GitHub handles, sorted
	 * @throws TeamDataException if any team's membership cannot be resolved
	 */
	Set<String> activeMembers() throws TeamDataException;

	/**
	 * Resolve the code-host teams of a team with the GitHub ids of its effective members.
	 * @param team the team to resolve
	 * @return one entry per mapping, in declaration order
	 * @throws TeamDataException if the membership cannot be resolved or a member is not a
	 * known person
	 */
	List<GitHubTeam> githubTeams(Team team) throws TeamDataException;

	/**
	 * Returns every {@code (org, name)} code-host team declared by an active team.
	 * @return declared code-host teams
	 */
	Set<GitHubTeamMapping> githubTeamKeys();

	/**
	 * Resolve the subscribers of each mailing list of a team.
	 * @param team the team owning the lists
	 * @return list address to GitHub handles, in declaration order
	 * @throws TeamDataException if a membership or an extra team cannot be resolved
	 */
	Map<String, Set<String>> mailingLists(Team team) throws TeamDataException;

	/**
	 * Resolve every Zulip user group declared by the active teams.
	 * @return group name to group, in declaration order
	 * @throws TeamDataException if a member cannot be resolved or a group name is declared
	 * twice
	 */
	Map<String, ZulipGroup> zulipGroups() throws TeamDataException;

}
