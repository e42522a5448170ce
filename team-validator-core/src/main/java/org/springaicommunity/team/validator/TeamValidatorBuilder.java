package org.springaicommunity.team.validator;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;

import java.io.IOException;

/**
 * Builder for creating the validator and its collaborators without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Credentials from the environment or a .env file
 * TeamValidatorBuilder builder = TeamValidatorBuilder.create().credentialsFromEnv();
 * TeamData data = builder.buildLoader().load(Path.of("team-data.json"));
 * builder.buildValidator().validate(data, false, Set.of());
 *
 * // For testing with directory doubles
 * TeamValidator validator = TeamValidatorBuilder.create()
 *     .githubDirectory(mock(GitHubDirectory.class))
 *     .zulipDirectory(mock(ZulipDirectory.class))
 *     .buildValidator();
 * }
 * </pre>
 *
 * <p>
 * Missing credentials are not an error here: the corresponding directory reports itself
 * unavailable when the validator probes it.
 */
public class TeamValidatorBuilder {

	private ValidatorProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable String githubToken;

	private @Nullable String zulipUsername;

	private @Nullable String zulipToken;

	private @Nullable GitHubClient githubClient;

	private @Nullable ZulipClient zulipClient;

	private @Nullable GitHubDirectory githubDirectory;

	private @Nullable ZulipDirectory zulipDirectory;

	private CheckRegistry registry = CheckRegistry.defaults();

	private TeamValidatorBuilder() {
		this.properties = new ValidatorProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new TeamValidatorBuilder
	 */
	public static TeamValidatorBuilder create() {
		return new TeamValidatorBuilder();
	}

	/**
	 * Read {@code GITHUB_TOKEN}, {@code ZULIP_USERNAME} and {@code ZULIP_TOKEN} through
	 * {@link EnvironmentSupport}.
	 * @return this builder
	 */
	public TeamValidatorBuilder credentialsFromEnv() {
		this.githubToken = EnvironmentSupport.get(EnvironmentSupport.GITHUB_TOKEN);
		this.zulipUsername = EnvironmentSupport.get(EnvironmentSupport.ZULIP_USERNAME);
		this.zulipToken = EnvironmentSupport.get(EnvironmentSupport.ZULIP_TOKEN);
		return this;
	}

	public TeamValidatorBuilder githubToken(@Nullable String githubToken) {
		this.githubToken = githubToken;
		return this;
	}

	public TeamValidatorBuilder zulipCredentials(@Nullable String username, @Nullable String token) {
		this.zulipUsername = username;
		this.zulipToken = token;
		return this;
	}

	/**
	 * Set validator properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public TeamValidatorBuilder properties(@Nullable ValidatorProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public TeamValidatorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. The token is still needed for the
	 * credential check.
	 * @param githubClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public TeamValidatorBuilder githubClient(@Nullable GitHubClient githubClient) {
		this.githubClient = githubClient;
		return this;
	}

	/**
	 * Set a custom ZulipClient implementation. When given, Zulip credentials are not
	 * required.
	 * @param zulipClient custom ZulipClient implementation (null to use default)
	 * @return this builder
	 */
	public TeamValidatorBuilder zulipClient(@Nullable ZulipClient zulipClient) {
		this.zulipClient = zulipClient;
		return this;
	}

	/**
	 * Replace the GitHub directory entirely. Useful for testing with mocks.
	 * @param githubDirectory custom directory (null to build one from the credentials)
	 * @return this builder
	 */
	public TeamValidatorBuilder githubDirectory(@Nullable GitHubDirectory githubDirectory) {
		this.githubDirectory = githubDirectory;
		return this;
	}

	/**
	 * Replace the Zulip directory entirely. Useful for testing with mocks.
	 * @param zulipDirectory custom directory (null to build one from the credentials)
	 * @return this builder
	 */
	public TeamValidatorBuilder zulipDirectory(@Nullable ZulipDirectory zulipDirectory) {
		this.zulipDirectory = zulipDirectory;
		return this;
	}

	public TeamValidatorBuilder registry(CheckRegistry registry) {
		this.registry = registry;
		return this;
	}

	public ValidatorProperties getProperties() {
		return properties;
	}

	/**
	 * Build the validator.
	 * @return configured TeamValidator
	 */
	public TeamValidator buildValidator() {
		return new TeamValidator(buildGitHubDirectory(), buildZulipDirectory(), registry);
	}

	/**
	 * Build the snapshot loader.
	 * @return configured TeamDataLoader
	 */
	public TeamDataLoader buildLoader() {
		return new TeamDataLoader(mapper());
	}

	public GitHubDirectory buildGitHubDirectory() {
		if (githubDirectory != null) {
			return githubDirectory;
		}
		String token = githubToken;
		if (token == null) {
			return new GitHubApiDirectory(null, null, mapper());
		}
		GitHubClient client = githubClient != null ? githubClient : new GitHubHttpClient(token);
		return new GitHubApiDirectory(connect(token), client, mapper());
	}

	public ZulipDirectory buildZulipDirectory() {
		if (zulipDirectory != null) {
			return zulipDirectory;
		}
		ZulipClient client = zulipClient;
		if (client == null && zulipUsername != null && zulipToken != null) {
			client = new ZulipHttpClient(properties.getZulipBaseUrl(), zulipUsername, zulipToken);
		}
		return new ZulipApiDirectory(client, mapper());
	}

	private ObjectMapper mapper() {
		return objectMapper != null ? objectMapper : ObjectMapperFactory.create();
	}

	static GitHub connect(String token) {
		try {
			return new GitHubBuilder().withOAuthToken(token).build();
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to create GitHub client: " + e.getMessage(), e);
		}
	}

}
