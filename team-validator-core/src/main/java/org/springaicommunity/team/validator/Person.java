package org.springaicommunity.team.validator;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * A person, keyed by their GitHub handle.
 *
 * @param github the GitHub handle (identity key)
 * @param name the person's display name
 * @param email optional email address
 * @param emailDisabled whether the person opted out of having an address on file
 * @param githubId the numeric GitHub account id
 * @param zulipId optional Zulip account id
 * @param discordId optional Discord account id
 * @param permissions capabilities granted directly to the person
 */
public record Person(String github, String name, @Nullable String email, boolean emailDisabled, long githubId,
		@Nullable Long zulipId, @Nullable Long discordId, Permissions permissions) {

	/**
	 * Presence of an email address for a person.
	 */
	public enum EmailState {

		MISSING, DISABLED, PRESENT

	}

	public Person {
		Objects.requireNonNull(github, "person github handle is required");
		if (permissions == null) {
			permissions = Permissions.none();
		}
	}

	public Person(String github, String name, @Nullable String email, long githubId) {
		this(github, name, email, false, githubId, null, null, Permissions.none());
	}

	public EmailState emailState() {
		if (emailDisabled) {
			return EmailState.DISABLED;
		}
		return email == null ? EmailState.MISSING : EmailState.PRESENT;
	}

	public Person withZulipId(@Nullable Long zulipId) {
		return new Person(github, name, email, emailDisabled, githubId, zulipId, discordId, permissions);
	}

	public Person withDiscordId(@Nullable Long discordId) {
		return new Person(github, name, email, emailDisabled, githubId, zulipId, discordId, permissions);
	}

	public Person withPermissions(Permissions permissions) {
		return new Person(github, name, email, emailDisabled, githubId, zulipId, discordId, permissions);
	}

}
