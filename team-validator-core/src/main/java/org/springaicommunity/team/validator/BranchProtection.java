package org.springaicommunity.team.validator;

import java.util.List;

/**
 * A branch protection rule of a repository.
 *
 * @param pattern the branch name pattern
 * @param ciChecks CI checks required to pass before merging
 * @param dismissStaleReview whether new pushes dismiss approvals
 */
public record BranchProtection(String pattern, List<String> ciChecks, boolean dismissStaleReview) {

	public BranchProtection {
		ciChecks = ciChecks == null ? List.of() : List.copyOf(ciChecks);
	}

}
