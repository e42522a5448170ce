package org.springaicommunity.team.validator;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Access level granted to a team or an individual on a repository.
 */
public enum RepoPermission {

	@JsonProperty("write")
	WRITE,

	@JsonProperty("admin")
	ADMIN,

	@JsonProperty("maintain")
	MAINTAIN,

	@JsonProperty("triage")
	TRIAGE

}
