package org.springaicommunity.team.validator;

import java.util.Collection;
import java.util.Map;

/**
 * Query interface over the GitHub user directory.
 */
public interface GitHubDirectory {

	/**
	 * Verify that the directory can be queried.
	 * @throws DirectoryException if no credentials are configured or they are rejected
	 */
	void requireAuth() throws DirectoryException;

	/**
	 * Resolve the current usernames of GitHub accounts.
	 * @param ids numeric GitHub account ids
	 * @return id to current login, for every account that still exists
	 * @throws DirectoryException if the directory cannot be queried
	 */
	Map<Long, String> usernames(Collection<Long> ids) throws DirectoryException;

}
