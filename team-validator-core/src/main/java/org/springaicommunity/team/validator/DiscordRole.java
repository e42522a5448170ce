package org.springaicommunity.team.validator;

import org.jspecify.annotations.Nullable;

/**
 * A Discord role bound to a team.
 *
 * @param name the role name
 * @param color optional role colour
 */
public record DiscordRole(String name, @Nullable String color) {
}
