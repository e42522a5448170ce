package org.springaicommunity.team.validator;

import java.util.List;

/**
 * A Zulip user group resolved from team data.
 *
 * @param name the group name
 * @param members the group members in declaration order
 */
public record ZulipGroup(String name, List<ZulipGroupMember> members) {

	public ZulipGroup {
		members = List.copyOf(members);
	}

}
