package org.springaicommunity.team.validator;

/**
 * Thrown when a derived view of the team data cannot be computed, for example when a
 * team includes the members of a team that does not exist.
 */
public class TeamDataException extends Exception {

	public TeamDataException(String message) {
		super(message);
	}

	public TeamDataException(String message, Throwable cause) {
		super(message, cause);
	}

}
