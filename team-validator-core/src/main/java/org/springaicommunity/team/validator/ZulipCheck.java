package org.springaicommunity.team.validator;

/**
 * A check that needs the Zulip directory.
 */
@FunctionalInterface
public interface ZulipCheck {

	void run(TeamData data, ZulipDirectory zulip, ValidationErrors errors);

}
