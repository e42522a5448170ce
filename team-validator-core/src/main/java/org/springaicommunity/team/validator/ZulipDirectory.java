package org.springaicommunity.team.validator;

import java.util.List;

/**
 * Query interface over the Zulip user directory.
 */
public interface ZulipDirectory {

	/**
	 * Verify that the directory can be queried.
	 * @throws DirectoryException if no credentials are configured
	 */
	void requireAuth() throws DirectoryException;

	/**
	 * List every user known to the Zulip organization.
	 * @return all users
	 * @throws DirectoryException if the directory cannot be queried
	 */
	List<ZulipUser> getUsers() throws DirectoryException;

}
