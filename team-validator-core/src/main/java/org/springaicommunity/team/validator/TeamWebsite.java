package org.springaicommunity.team.validator;

import org.jspecify.annotations.Nullable;

/**
 * Metadata published on the governance website for a team.
 *
 * @param name display name
 * @param description short description of the team's responsibilities
 * @param page optional page slug
 * @param email optional contact address
 * @param repo optional repository URL
 * @param zulipStream optional chat stream name (a name, not a link)
 * @param weight ordering weight on the website
 */
public record TeamWebsite(String name, String description, @Nullable String page, @Nullable String email,
		@Nullable String repo, @Nullable String zulipStream, long weight) {

	public TeamWebsite(String name, String description) {
		this(name, description, null, null, null, null, 0);
	}

}
