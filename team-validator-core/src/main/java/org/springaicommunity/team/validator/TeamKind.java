package org.springaicommunity.team.validator;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The kind of a team entry. Only top-level {@link #TEAM}s may have working groups or
 * project groups nested below their subteams.
 */
public enum TeamKind {

	@JsonProperty("team")
	TEAM("team"),

	@JsonProperty("working_group")
	WORKING_GROUP("working group"),

	@JsonProperty("project_group")
	PROJECT_GROUP("project group"),

	@JsonProperty("marker_team")
	MARKER_TEAM("marker team"),

	@JsonEnumDefaultValue
	@JsonProperty("unknown")
	UNKNOWN("unknown");

	private final String displayName;

	TeamKind(String displayName) {
		this.displayName = displayName;
	}

	/**
	 * Returns the human-readable name used in violation messages, e.g. "working group".
	 */
	@Override
	public String toString() {
		return displayName;
	}

}
