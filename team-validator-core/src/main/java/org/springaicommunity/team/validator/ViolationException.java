package org.springaicommunity.team.validator;

/**
 * Raised by a per-item check to report a single violation. The message is the violation
 * text recorded in {@link ValidationErrors}.
 */
public class ViolationException extends Exception {

	public ViolationException(String message) {
		super(message);
	}

}
