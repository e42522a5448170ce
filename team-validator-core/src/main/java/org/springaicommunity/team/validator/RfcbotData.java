package org.springaicommunity.team.validator;

import java.util.List;

/**
 * rfcbot integration settings of a team.
 *
 * @param label the GitHub label rfcbot uses for the team
 * @param name the team name shown by rfcbot
 * @param ping the handle rfcbot pings
 * @param excludeMembers team members that are not asked to review
 */
public record RfcbotData(String label, String name, String ping, List<String> excludeMembers) {

	public RfcbotData {
		excludeMembers = excludeMembers == null ? List.of() : List.copyOf(excludeMembers);
	}

}
