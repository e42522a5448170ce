package org.springaicommunity.team.validator;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.springaicommunity.team.validator.CheckSupport.forEach;

/**
 * Checks over Zulip user groups.
 */
final class ZulipChecks {

	private ZulipChecks() {
	}

	/**
	 * Members of a team with a Zulip group that includes the team members need a Zulip id.
	 */
	static void validateZulipGroupIds(TeamData data, ValidationErrors errors) {
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			boolean includesMembers = team.zulipGroups().stream().anyMatch(TeamZulipGroup::includeTeamMembers);
			if (!includesMembers) {
				return;
			}
			forEach(data.effectiveMembers(team), e, (String member, ValidationErrors inner) -> {
				Person person = data.person(member).orElse(null);
				if (person != null && person.zulipId() == null) {
					throw new ViolationException("person `" + member + "` in `" + team.name()
							+ "` is a member of a Zulip user group but has no Zulip id");
				}
			});
		});
	}

	static void validateZulipGroupExtraPeople(TeamData data, ValidationErrors errors) {
		forEach(data.teams(), errors, (Team team, ValidationErrors e) -> {
			forEach(team.zulipGroups(), e, (TeamZulipGroup group, ValidationErrors inner) -> {
				for (String person : group.extraPeople()) {
					if (data.person(person).isEmpty()) {
						throw new ViolationException(
								"person `" + person + "` does not exist (in Zulip group `" + group.name() + "`)");
					}
				}
			});
		});
	}

	/**
	 * Every member of every Zulip group must be a known Zulip account. Members without a
	 * Zulip id are always reported.
	 */
	static void validateZulipUsers(TeamData data, ZulipDirectory zulip, ValidationErrors errors) {
		Set<Long> knownIds = new HashSet<>();
		try {
			for (ZulipUser user : zulip.getUsers()) {
				knownIds.add(user.userId());
			}
		}
		catch (DirectoryException ex) {
			errors.add("couldn't verify Zulip users: " + ex.getMessage());
			return;
		}

		Map<String, ZulipGroup> groups;
		try {
			groups = data.zulipGroups();
		}
		catch (TeamDataException ex) {
			errors.add("couldn't get all the Zulip groups: " + ex.getMessage());
			return;
		}

		forEach(groups.values(), errors, (ZulipGroup group, ValidationErrors e) -> {
			Set<String> missing = missingMembers(group.members(), knownIds);
			if (!missing.isEmpty()) {
				throw new ViolationException("the \"" + group.name()
						+ "\" Zulip group includes members who don't appear on Zulip: " + String.join(", ", missing));
			}
		});
	}

	private static Set<String> missingMembers(List<ZulipGroupMember> members, Set<Long> knownIds) {
		Set<String> missing = new TreeSet<>();
		for (ZulipGroupMember member : members) {
			switch (member.shape()) {
				case JUST_ID -> {
					if (!knownIds.contains(member.zulipId())) {
						missing.add("ID: " + member.zulipId());
					}
				}
				case MEMBER_WITH_ID -> {
					if (!knownIds.contains(member.zulipId())) {
						missing.add(member.github());
					}
				}
				case MEMBER_WITHOUT_ID -> missing.add(member.github());
			}
		}
		return missing;
	}

}
