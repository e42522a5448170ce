package org.springaicommunity.team.validator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.kohsuke.github.GitHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link GitHubDirectory} backed by the GitHub APIs.
 *
 * <p>
 * The token is checked through the {@code github-api} client. Account ids are resolved
 * to logins with the GraphQL {@code nodes} query, using the legacy global node id of each
 * user, at most {@value #BATCH_SIZE} ids per request. Accounts that no longer exist are
 * left out of the result.
 */
public class GitHubApiDirectory implements GitHubDirectory {

	private static final Logger logger = LoggerFactory.getLogger(GitHubApiDirectory.class);

	static final int BATCH_SIZE = 100;

	private static final String USERNAMES_QUERY = """
			query($ids: [ID!]!) {
			    nodes(ids: $ids) {
			        ... on User {
			            databaseId
			            login
			        }
			    }
			}
			""";

	private final @Nullable GitHub gitHub;

	private final @Nullable GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	/**
	 * Create a directory.
	 * @param gitHub authenticated API client, or {@code null} when no token is configured
	 * @param httpClient GraphQL client, or {@code null} when no token is configured
	 * @param objectMapper mapper for request and response bodies
	 */
	public GitHubApiDirectory(@Nullable GitHub gitHub, @Nullable GitHubClient httpClient, ObjectMapper objectMapper) {
		this.gitHub = gitHub;
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public void requireAuth() throws DirectoryException {
		if (gitHub == null || httpClient == null) {
			throw new DirectoryException("missing environment variable GITHUB_TOKEN");
		}
		if (!gitHub.isCredentialValid()) {
			throw new DirectoryException("the GitHub token is not valid");
		}
	}

	@Override
	public Map<Long, String> usernames(Collection<Long> ids) throws DirectoryException {
		GitHubClient client = httpClient;
		if (client == null) {
			throw new DirectoryException("missing environment variable GITHUB_TOKEN");
		}
		List<Long> pending = new ArrayList<>(ids);
		Map<Long, String> usernames = new LinkedHashMap<>();
		for (int from = 0; from < pending.size(); from += BATCH_SIZE) {
			List<Long> batch = pending.subList(from, Math.min(from + BATCH_SIZE, pending.size()));
			logger.debug("Resolving {} GitHub usernames", batch.size());
			JsonNode response = executeGraphQL(client, batch);
			for (JsonNode node : response.path("data").path("nodes")) {
				if (node.hasNonNull("databaseId") && node.hasNonNull("login")) {
					usernames.put(node.get("databaseId").asLong(), node.get("login").asText());
				}
			}
		}
		return usernames;
	}

	private JsonNode executeGraphQL(GitHubClient client, List<Long> ids) throws DirectoryException {
		List<String> nodeIds = ids.stream().map(GitHubApiDirectory::userNodeId).toList();
		JsonNode response;
		try {
			String body = objectMapper
				.writeValueAsString(Map.of("query", USERNAMES_QUERY, "variables", Map.of("ids", nodeIds)));
			response = objectMapper.readTree(client.postGraphQL(body));
		}
		catch (JsonProcessingException e) {
			throw new DirectoryException("malformed GitHub GraphQL response: " + e.getOriginalMessage(), e);
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			throw new DirectoryException(e.getMessage(), e);
		}
		for (JsonNode error : response.path("errors")) {
			// deleted accounts come back as NOT_FOUND errors next to the resolved nodes
			if (!"NOT_FOUND".equals(error.path("type").asText())) {
				throw new DirectoryException("GitHub GraphQL error: " + error.path("message").asText());
			}
		}
		return response;
	}

	/**
	 * Legacy global node id of a user account: {@code base64("04:User" + id)}.
	 */
	static String userNodeId(long id) {
		return Base64.getEncoder().encodeToString(("04:User" + id).getBytes(StandardCharsets.UTF_8));
	}

}
