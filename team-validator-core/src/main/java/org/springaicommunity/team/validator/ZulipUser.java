package org.springaicommunity.team.validator;

import org.jspecify.annotations.Nullable;

/**
 * A user account of the Zulip organization.
 *
 * @param userId the numeric Zulip id
 * @param email the account email (may be null when hidden)
 * @param fullName the display name (may be null)
 */
public record ZulipUser(long userId, @Nullable String email, @Nullable String fullName) {
}
