package org.springaicommunity.team.validator;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Bot integrations that can be enabled on a repository.
 */
public enum Bot {

	@JsonProperty("bors")
	BORS,

	@JsonProperty("highfive")
	HIGHFIVE,

	@JsonProperty("rustbot")
	RUSTBOT,

	@JsonProperty("rust-timer")
	RUST_TIMER,

	@JsonProperty("rfcbot")
	RFCBOT

}
