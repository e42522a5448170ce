package org.springaicommunity.team.validator;

import java.util.List;
import java.util.Objects;

/**
 * A repository managed through the team data.
 *
 * @param org the owning GitHub organization
 * @param name the repository name
 * @param description the repository description
 * @param bots bot integrations enabled on the repository
 * @param access team and individual access grants
 * @param branchProtections branch protection rules
 */
public record Repo(String org, String name, String description, List<Bot> bots, RepoAccess access,
		List<BranchProtection> branchProtections) {

	public Repo {
		Objects.requireNonNull(org, "repo org is required");
		Objects.requireNonNull(name, "repo name is required");
		bots = bots == null ? List.of() : List.copyOf(bots);
		access = access == null ? RepoAccess.none() : access;
		branchProtections = branchProtections == null ? List.of() : List.copyOf(branchProtections);
	}

	public Repo(String org, String name, RepoAccess access) {
		this(org, name, "", List.of(), access, List.of());
	}

}
