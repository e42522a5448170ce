package org.springaicommunity.team.validator;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.springaicommunity.team.validator.CheckSupport.forEach;

/**
 * Checks over mailing lists.
 */
final class ListChecks {

	private static final Pattern LIST_ADDRESS = Pattern.compile("^[a-zA-Z0-9_.-]+@([a-zA-Z0-9_.-]+)$");

	private ListChecks() {
	}

	/**
	 * Members of a team owning a mailing list need an email address, unless they opted out.
	 */
	static void validateListEmailAddresses(TeamData data, ValidationErrors errors) {
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			if (data.mailingLists(team).isEmpty()) {
				return;
			}
			forEach(data.effectiveMembers(team), e, (String member, ValidationErrors inner) -> {
				Person person = data.person(member).orElse(null);
				if (person != null && person.emailState() == Person.EmailState.MISSING) {
					throw new ViolationException(
							"person `" + member + "` is a member of a mailing list but has no email address");
				}
			});
		});
	}

	static void validateListExtraPeople(TeamData data, ValidationErrors errors) {
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			forEach(team.lists(), e, (TeamList list, ValidationErrors inner) -> {
				for (String person : list.extraPeople()) {
					if (data.person(person).isEmpty()) {
						throw new ViolationException(
								"person `" + person + "` does not exist (in list `" + list.address() + "`)");
					}
				}
			});
		});
	}

	static void validateListExtraTeams(TeamData data, ValidationErrors errors) {
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			forEach(team.lists(), e, (TeamList list, ValidationErrors inner) -> {
				for (String extraTeam : list.extraTeams()) {
					if (data.team(extraTeam).isEmpty()) {
						throw new ViolationException(
								"team `" + extraTeam + "` does not exist (in list `" + list.address() + "`)");
					}
				}
			});
		});
	}

	/**
	 * List addresses must be well formed and live on a domain we own.
	 */
	static void validateListAddresses(TeamData data, ValidationErrors errors) {
		Set<String> domains = data.config().allowedMailingListDomains();
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			forEach(team.lists(), e, (TeamList list, ValidationErrors inner) -> {
				Matcher matcher = LIST_ADDRESS.matcher(list.address());
				if (!matcher.matches()) {
					throw new ViolationException("invalid list address: `" + list.address() + "`");
				}
				if (!domains.contains(matcher.group(1))) {
					throw new ViolationException("list address on a domain we don't own: `" + list.address() + "`");
				}
			});
		});
	}

}
