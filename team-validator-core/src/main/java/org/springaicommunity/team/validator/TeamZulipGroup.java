package org.springaicommunity.team.validator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A Zulip user group declared by a team.
 *
 * @param name the group name
 * @param includeTeamMembers whether the team's effective members belong to the group
 * @param extraPeople additional people by GitHub handle
 * @param extraZulipIds additional Zulip accounts by numeric id
 * @param excludedPeople people removed from the group
 */
public record TeamZulipGroup(String name, boolean includeTeamMembers, List<String> extraPeople,
		List<Long> extraZulipIds, List<String> excludedPeople) {

	public TeamZulipGroup {
		extraPeople = extraPeople == null ? List.of() : List.copyOf(extraPeople);
		extraZulipIds = extraZulipIds == null ? List.of() : List.copyOf(extraZulipIds);
		excludedPeople = excludedPeople == null ? List.of() : List.copyOf(excludedPeople);
	}

	public TeamZulipGroup(String name) {
		this(name, true, List.of(), List.of(), List.of());
	}

	/**
	 * JSON factory: a group includes the team members unless the snapshot says otherwise.
	 */
	@JsonCreator
	static TeamZulipGroup fromJson(@JsonProperty("name") String name,
			@JsonProperty("include_team_members") @Nullable Boolean includeTeamMembers,
			@JsonProperty("extra_people") @Nullable List<String> extraPeople,
			@JsonProperty("extra_zulip_ids") @Nullable List<Long> extraZulipIds,
			@JsonProperty("excluded_people") @Nullable List<String> excludedPeople) {
		return new TeamZulipGroup(name, includeTeamMembers == null || includeTeamMembers, extraPeople, extraZulipIds,
				excludedPeople);
	}

}
