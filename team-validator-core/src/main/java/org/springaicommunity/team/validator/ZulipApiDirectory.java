package org.springaicommunity.team.validator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ZulipDirectory} backed by the Zulip REST API.
 */
public class ZulipApiDirectory implements ZulipDirectory {

	private static final Logger logger = LoggerFactory.getLogger(ZulipApiDirectory.class);

	private final @Nullable ZulipClient client;

	private final ObjectMapper objectMapper;

	/**
	 * Create a directory.
	 * @param client API client, or {@code null} when no credentials are configured
	 * @param objectMapper mapper for response bodies
	 */
	public ZulipApiDirectory(@Nullable ZulipClient client, ObjectMapper objectMapper) {
		this.client = client;
		this.objectMapper = objectMapper;
	}

	@Override
	public void requireAuth() throws DirectoryException {
		if (client == null) {
			throw new DirectoryException("missing ZULIP_USERNAME and/or ZULIP_TOKEN environment variables");
		}
	}

	@Override
	public List<ZulipUser> getUsers() throws DirectoryException {
		ZulipClient zulip = client;
		if (zulip == null) {
			throw new DirectoryException("missing ZULIP_USERNAME and/or ZULIP_TOKEN environment variables");
		}
		JsonNode response;
		try {
			response = objectMapper.readTree(zulip.get("/users"));
		}
		catch (JsonProcessingException e) {
			throw new DirectoryException("malformed Zulip response: " + e.getOriginalMessage(), e);
		}
		catch (ZulipHttpClient.ZulipApiException e) {
			throw new DirectoryException(e.getMessage(), e);
		}

		if (!"success".equals(response.path("result").asText())) {
			throw new DirectoryException("Zulip API error: " + response.path("msg").asText("unknown error"));
		}

		List<ZulipUser> users = new ArrayList<>();
		for (JsonNode member : response.path("members")) {
			users.add(new ZulipUser(member.path("user_id").asLong(), textOrNull(member, "email"),
					textOrNull(member, "full_name")));
		}
		logger.debug("Fetched {} Zulip users", users.size());
		return users;
	}

	private static @Nullable String textOrNull(JsonNode node, String field) {
		return node.hasNonNull(field) ? node.get(field).asText() : null;
	}

}
