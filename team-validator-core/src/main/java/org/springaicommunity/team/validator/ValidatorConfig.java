package org.springaicommunity.team.validator;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the validator, its directory adapters and related beans.
 *
 * <p>
 * Credentials are optional: an empty value leaves the matching directory unavailable.
 */
@Configuration
public class ValidatorConfig {

	@Value("${GITHUB_TOKEN:}")
	private String githubToken;

	@Value("${ZULIP_USERNAME:}")
	private String zulipUsername;

	@Value("${ZULIP_TOKEN:}")
	private String zulipToken;

	@Value("${team.validator.zulip-base-url:https://rust-lang.zulipchat.com/api/v1}")
	private String zulipBaseUrl;

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public ValidatorProperties validatorProperties() {
		ValidatorProperties properties = new ValidatorProperties();
		properties.setZulipBaseUrl(zulipBaseUrl);
		return properties;
	}

	@Bean
	public GitHubDirectory gitHubDirectory(ObjectMapper objectMapper) {
		if (githubToken.isBlank()) {
			return new GitHubApiDirectory(null, null, objectMapper);
		}
		return new GitHubApiDirectory(TeamValidatorBuilder.connect(githubToken), new GitHubHttpClient(githubToken),
				objectMapper);
	}

	@Bean
	public ZulipDirectory zulipDirectory(ValidatorProperties validatorProperties, ObjectMapper objectMapper) {
		if (zulipUsername.isBlank() || zulipToken.isBlank()) {
			return new ZulipApiDirectory(null, objectMapper);
		}
		return new ZulipApiDirectory(
				new ZulipHttpClient(validatorProperties.getZulipBaseUrl(), zulipUsername, zulipToken), objectMapper);
	}

	@Bean
	public TeamValidator teamValidator(GitHubDirectory gitHubDirectory, ZulipDirectory zulipDirectory) {
		return new TeamValidator(gitHubDirectory, zulipDirectory, CheckRegistry.defaults());
	}

	@Bean
	public TeamDataLoader teamDataLoader(ObjectMapper objectMapper) {
		return new TeamDataLoader(objectMapper);
	}

	@Bean
	public ArgumentParser argumentParser(ValidatorProperties validatorProperties) {
		return new ArgumentParser(validatorProperties);
	}

}
