package org.springaicommunity.team.validator;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for a validation run.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link TeamValidatorBuilder}.
 * Command-line arguments parsed by {@link ArgumentParser} start from these values.
 */
public class ValidatorProperties {

	/**
	 * Path of the JSON snapshot of the team data.
	 */
	private String dataFile = "team-data.json";

	/**
	 * Fail the run when the GitHub API cannot be used.
	 */
	private boolean strict = false;

	/**
	 * Names of checks not to run.
	 */
	private List<String> skip = new ArrayList<>();

	/**
	 * Base URL of the Zulip REST API.
	 */
	private String zulipBaseUrl = "https://rust-lang.zulipchat.com/api/v1";

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	/**
	 * Returns the path of the team data snapshot.
	 * @return the data file
	 */
	public String getDataFile() {
		return dataFile;
	}

	/**
	 * Sets the path of the team data snapshot.
	 * @param dataFile the data file
	 */
	public void setDataFile(String dataFile) {
		this.dataFile = dataFile;
	}

	/**
	 * Returns whether an unusable GitHub API fails the run.
	 * @return true in strict mode
	 */
	public boolean isStrict() {
		return strict;
	}

	/**
	 * Sets whether an unusable GitHub API fails the run.
	 * @param strict true for strict mode
	 */
	public void setStrict(boolean strict) {
		this.strict = strict;
	}

	/**
	 * Returns the names of the checks to skip.
	 * @return skipped check names
	 */
	public List<String> getSkip() {
		return skip;
	}

	/**
	 * Sets the names of the checks to skip.
	 * @param skip skipped check names
	 */
	public void setSkip(List<String> skip) {
		this.skip = skip;
	}

	/**
	 * Returns the base URL of the Zulip REST API.
	 * @return the Zulip base URL
	 */
	public String getZulipBaseUrl() {
		return zulipBaseUrl;
	}

	/**
	 * Sets the base URL of the Zulip REST API.
	 * @param zulipBaseUrl the Zulip base URL
	 */
	public void setZulipBaseUrl(String zulipBaseUrl) {
		this.zulipBaseUrl = zulipBaseUrl;
	}

	/**
	 * Returns whether verbose logging is enabled.
	 * @return true if verbose
	 */
	public boolean isVerbose() {
		return verbose;
	}

	/**
	 * Sets whether verbose logging is enabled.
	 * @param verbose true for verbose output
	 */
	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
