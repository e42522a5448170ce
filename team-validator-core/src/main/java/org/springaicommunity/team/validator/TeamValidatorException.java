package org.springaicommunity.team.validator;

/**
 * Base class for failures that end a validation run.
 */
public abstract class TeamValidatorException extends Exception {

	protected TeamValidatorException(String message) {
		super(message);
	}

	protected TeamValidatorException(String message, Throwable cause) {
		super(message, cause);
	}

}
