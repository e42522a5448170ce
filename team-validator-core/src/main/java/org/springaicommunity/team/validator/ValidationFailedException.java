package org.springaicommunity.team.validator;

import java.util.List;

/**
 * Aggregate failure of a validation run. The individual violations have already been
 * logged by {@link TeamValidator}; they are also available through {@link #errors()}.
 */
public class ValidationFailedException extends TeamValidatorException {

	private final List<String> errors;

	public ValidationFailedException(List<String> errors) {
		super(errors.size() + " validation errors found");
		this.errors = List.copyOf(errors);
	}

	/**
	 * Returns the deduplicated, sorted violation messages.
	 * @return violation messages
	 */
	public List<String> errors() {
		return errors;
	}

}
