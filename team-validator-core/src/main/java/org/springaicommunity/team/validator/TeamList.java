package org.springaicommunity.team.validator;

import java.util.List;
import java.util.Objects;

/**
 * A mailing list bound to a team.
 *
 * @param address the list address
 * @param extraPeople people subscribed in addition to the team members
 * @param extraTeams teams whose members are subscribed in addition
 */
public record TeamList(String address, List<String> extraPeople, List<String> extraTeams) {

	public TeamList {
		Objects.requireNonNull(address, "list address is required");
		extraPeople = extraPeople == null ? List.of() : List.copyOf(extraPeople);
		extraTeams = extraTeams == null ? List.of() : List.copyOf(extraTeams);
	}

	public TeamList(String address) {
		this(address, List.of(), List.of());
	}

}
