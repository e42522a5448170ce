package org.springaicommunity.team.validator;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * A member of a resolved Zulip user group.
 *
 * <p>
 * Members come in three shapes, identified by {@link Shape}: a bare Zulip id, a GitHub
 * handle whose Zulip id is known, and a GitHub handle without a Zulip id. Use the static
 * factories; they enforce which components each shape carries.
 *
 * @param shape which of the three encodings this member uses
 * @param github the GitHub handle, absent for {@link Shape#JUST_ID}
 * @param zulipId the Zulip id, absent for {@link Shape#MEMBER_WITHOUT_ID}
 */
public record ZulipGroupMember(Shape shape, @Nullable String github, @Nullable Long zulipId) {

	/**
	 * Encodings of a group member.
	 */
	public enum Shape {

		JUST_ID, MEMBER_WITH_ID, MEMBER_WITHOUT_ID

	}

	public ZulipGroupMember {
		Objects.requireNonNull(shape, "shape");
		switch (shape) {
			case JUST_ID -> {
				Objects.requireNonNull(zulipId, "zulipId");
				github = null;
			}
			case MEMBER_WITH_ID -> {
				Objects.requireNonNull(github, "github");
				Objects.requireNonNull(zulipId, "zulipId");
			}
			case MEMBER_WITHOUT_ID -> {
				Objects.requireNonNull(github, "github");
				zulipId = null;
			}
		}
	}

	public static ZulipGroupMember justId(long zulipId) {
		return new ZulipGroupMember(Shape.JUST_ID, null, zulipId);
	}

	public static ZulipGroupMember withId(String github, long zulipId) {
		return new ZulipGroupMember(Shape.MEMBER_WITH_ID, github, zulipId);
	}

	public static ZulipGroupMember withoutId(String github) {
		return new ZulipGroupMember(Shape.MEMBER_WITHOUT_ID, github, null);
	}

}
