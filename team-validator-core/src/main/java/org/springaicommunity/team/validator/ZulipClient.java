package org.springaicommunity.team.validator;

/**
 * Interface for Zulip REST API HTTP operations.
 */
public interface ZulipClient {

	/**
	 * Execute a GET request against the Zulip REST API.
	 * @param path API path relative to the configured base URL (e.g., "/users")
	 * @return Response body as String
	 * @throws ZulipHttpClient.ZulipApiException if the request fails
	 */
	String get(String path);

}
