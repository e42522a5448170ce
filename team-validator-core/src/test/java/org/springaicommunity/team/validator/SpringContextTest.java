package org.springaicommunity.team.validator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import static org.assertj.core.api.Assertions.*;

/**
 * Spring context tests for {@link ValidatorConfig}.
 *
 * <p>
 * Credentials are blanked so that no directory can reach a real API.
 */
@SpringJUnitConfig(ValidatorConfig.class)
@TestPropertySource(properties = { "GITHUB_TOKEN=", "ZULIP_USERNAME=", "ZULIP_TOKEN=",
		"team.validator.zulip-base-url=https://zulip.example.com/api/v1" })
@DisplayName("Team Validator - Spring Context Tests")
class SpringContextTest {

	@Autowired
	private ValidatorProperties validatorProperties;

	@Autowired
	private TeamValidator teamValidator;

	@Autowired
	private GitHubDirectory gitHubDirectory;

	@Autowired
	private ZulipDirectory zulipDirectory;

	@Autowired
	private TeamDataLoader teamDataLoader;

	@Autowired
	private ArgumentParser argumentParser;

	@Nested
	@DisplayName("Spring Bean Wiring Validation")
	class SpringBeanWiringTest {

		@Test
		@DisplayName("Should bind the Zulip base URL")
		void shouldBindZulipBaseUrl() {
			assertThat(validatorProperties.getZulipBaseUrl()).isEqualTo("https://zulip.example.com/api/v1");
		}

		@Test
		@DisplayName("Should wire the validator with the default checks")
		void shouldWireValidator() {
			assertThat(teamValidator.getRegistry().names()).contains("subteam-of", "github-usernames", "zulip-users");
			assertThat(teamDataLoader).isNotNull();
			assertThat(argumentParser.generateHelpText()).startsWith("Usage: team-validator");
		}

	}

	@Nested
	@DisplayName("Safety Verification")
	class SafetyVerificationTest {

		@Test
		@DisplayName("Should wire directories that report missing credentials")
		void shouldWireUnavailableDirectories() {
			assertThatThrownBy(gitHubDirectory::requireAuth).isInstanceOf(DirectoryException.class)
				.hasMessage("missing environment variable GITHUB_TOKEN");
			assertThatThrownBy(zulipDirectory::requireAuth).isInstanceOf(DirectoryException.class)
				.hasMessage("missing ZULIP_USERNAME and/or ZULIP_TOKEN environment variables");
		}

	}

}
