package org.springaicommunity.team.validator;

/**
 * A check that only reads the team data.
 */
@FunctionalInterface
public interface LocalCheck {

	void run(TeamData data, ValidationErrors errors);

}
