package org.springaicommunity.team.validator;

/**
 * Thrown when an external directory (GitHub or Zulip) cannot be reached, is not
 * authenticated, or returns an unusable response.
 */
public class DirectoryException extends TeamValidatorException {

	public DirectoryException(String message) {
		super(message);
	}

	public DirectoryException(String message, Throwable cause) {
		super(message, cause);
	}

}
