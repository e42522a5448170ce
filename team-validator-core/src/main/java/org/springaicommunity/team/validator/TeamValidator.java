package org.springaicommunity.team.validator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Runs every registered check against a team data set and aggregates the violations.
 *
 * <p>
 * Tiers run in order: local checks, then GitHub checks, then Zulip checks. A directory
 * that cannot be reached skips its tier with a warning, except that an unreachable
 * GitHub directory aborts the run in strict mode. Violations are reported deduplicated
 * and sorted, so the outcome does not depend on check order. A check that fails with a
 * runtime exception is reported as a violation and the remaining checks still run.
 *
 * <p>
 * Instances are stateless and may be reused, but a single run is single-threaded.
 */
public class TeamValidator {

	private static final Logger logger = LoggerFactory.getLogger(TeamValidator.class);

	private final GitHubDirectory github;

	private final ZulipDirectory zulip;

	private final CheckRegistry registry;

	public TeamValidator(GitHubDirectory github, ZulipDirectory zulip) {
		this(github, zulip, CheckRegistry.defaults());
	}

	public TeamValidator(GitHubDirectory github, ZulipDirectory zulip, CheckRegistry registry) {
		this.github = github;
		this.zulip = zulip;
		this.registry = registry;
	}

	public CheckRegistry getRegistry() {
		return registry;
	}

	/**
	 * Validate the team data.
	 * @param data the data set to validate
	 * @param strict whether an unreachable GitHub directory fails the run
	 * @param skip names of checks not to run
	 * @throws ValidationFailedException if any violation was found
	 * @throws DirectoryException in strict mode, if the GitHub directory is unreachable
	 */
	public void validate(TeamData data, boolean strict, Set<String> skip)
			throws ValidationFailedException, DirectoryException {
		ValidationErrors errors = new ValidationErrors();

		for (NamedCheck<LocalCheck> check : registry.localChecks()) {
			if (skipped(check, skip)) {
				continue;
			}
			runIsolated(check, errors, () -> check.check().run(data, errors));
		}

		if (available(github::requireAuth, "GitHub", strict)) {
			for (NamedCheck<GitHubCheck> check : registry.githubChecks()) {
				if (skipped(check, skip)) {
					continue;
				}
				runIsolated(check, errors, () -> check.check().run(data, github, errors));
			}
		}

		if (available(zulip::requireAuth, "Zulip", false)) {
			for (NamedCheck<ZulipCheck> check : registry.zulipChecks()) {
				if (skipped(check, skip)) {
					continue;
				}
				runIsolated(check, errors, () -> check.check().run(data, zulip, errors));
			}
		}

		if (!errors.isEmpty()) {
			List<String> report = errors.sortedDistinct();
			for (String error : report) {
				logger.error("validation error: {}", error);
			}
			throw new ValidationFailedException(report);
		}
		logger.info("Validation passed");
	}

	private static boolean skipped(NamedCheck<?> check, Set<String> skip) {
		if (skip.contains(check.name())) {
			logger.warn("skipped check: {}", check.name());
			return true;
		}
		return false;
	}

	/**
	 * Run one check. A runtime failure becomes a violation of its own so that the
	 * violations collected so far are still reported.
	 */
	private static void runIsolated(NamedCheck<?> check, ValidationErrors errors, Runnable body) {
		logger.debug("Running check: {}", check.name());
		try {
			body.run();
		}
		catch (RuntimeException ex) {
			logger.error("check {} failed", check.name(), ex);
			errors.add("check `" + check.name() + "` failed: " + ex.getMessage());
		}
	}

	private static boolean available(AuthProbe probe, String service, boolean fatal) throws DirectoryException {
		try {
			probe.requireAuth();
			return true;
		}
		catch (DirectoryException ex) {
			if (fatal) {
				throw ex;
			}
			logger.warn("couldn't perform checks relying on the {} API, some errors will not be detected", service);
			logger.warn("cause: {}", ex.getMessage());
			return false;
		}
	}

	@FunctionalInterface
	private interface AuthProbe {

		void requireAuth() throws DirectoryException;

	}

}
