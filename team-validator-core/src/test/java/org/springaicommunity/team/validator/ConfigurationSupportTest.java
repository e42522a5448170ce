package org.springaicommunity.team.validator;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the configuration support classes using plain JUnit.
 */
@DisplayName("ConfigurationSupport Tests")
class ConfigurationSupportTest {

	@Nested
	@DisplayName("ValidatorProperties Tests - Plain JUnit")
	class ValidatorPropertiesPlainTest {

		private ValidatorProperties properties;

		@BeforeEach
		void setUp() {
			properties = new ValidatorProperties();
		}

		@Test
		@DisplayName("Should have correct default properties")
		void shouldHaveCorrectDefaultProperties() {
			assertThat(properties.getDataFile()).isEqualTo("team-data.json");
			assertThat(properties.isStrict()).isFalse();
			assertThat(properties.getSkip()).isEmpty();
			assertThat(properties.getZulipBaseUrl()).isEqualTo("https://rust-lang.zulipchat.com/api/v1");
			assertThat(properties.isVerbose()).isFalse();
		}

		@Test
		@DisplayName("Should have working getters and setters")
		void shouldHaveWorkingGettersAndSetters() {
			properties.setDataFile("other.json");
			properties.setStrict(true);
			properties.setVerbose(true);
			properties.setZulipBaseUrl("https://zulip.example.com/api/v1");

			assertThat(properties.getDataFile()).isEqualTo("other.json");
			assertThat(properties.isStrict()).isTrue();
			assertThat(properties.isVerbose()).isTrue();
			assertThat(properties.getZulipBaseUrl()).isEqualTo("https://zulip.example.com/api/v1");
		}

	}

	@Nested
	@DisplayName("ObjectMapperFactory Tests")
	class ObjectMapperFactoryTest {

		@Test
		@DisplayName("Should map snake_case keys and ignore unknown ones")
		void shouldMapSnakeCase() throws Exception {
			ObjectMapper mapper = ObjectMapperFactory.create();

			TeamWebsite website = mapper.readValue(
					"{\"name\": \"T\", \"description\": \"d\", \"zulip_stream\": \"t\", \"discord_invite\": \"x\"}",
					TeamWebsite.class);

			assertThat(website.zulipStream()).isEqualTo("t");
		}

	}

}
