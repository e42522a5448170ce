package org.springaicommunity.team.validator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ArgumentParser using plain JUnit only.
 */
@DisplayName("ArgumentParser Tests - Plain JUnit Only")
class ArgumentParserTest {

	private ValidatorProperties defaultProperties;

	private ArgumentParser argumentParser;

	@BeforeEach
	void setUp() {
		defaultProperties = new ValidatorProperties();
		argumentParser = new ArgumentParser(defaultProperties);
	}

	@Nested
	@DisplayName("Basic Argument Parsing Tests")
	class BasicArgumentParsingTest {

		@Test
		@DisplayName("Should use defaults without arguments")
		void shouldUseDefaults() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[0]);

			assertThat(config.dataFile).isEqualTo("team-data.json");
			assertThat(config.strict).isFalse();
			assertThat(config.skip).isEmpty();
			assertThat(config.listChecks).isFalse();
			assertThat(config.verbose).isFalse();
		}

		@ParameterizedTest
		@ValueSource(strings = { "-d", "--data" })
		@DisplayName("Should parse the data file option")
		void shouldParseDataFile(String option) {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { option, "data/teams.json" });

			assertThat(config.dataFile).isEqualTo("data/teams.json");
		}

		@Test
		@DisplayName("Should parse flags")
		void shouldParseFlags() {
			ParsedConfiguration config = argumentParser
				.parseAndValidate(new String[] { "--strict", "--list-checks", "-v" });

			assertThat(config.strict).isTrue();
			assertThat(config.listChecks).isTrue();
			assertThat(config.verbose).isTrue();
		}

		@Test
		@DisplayName("Should collect skipped checks from repeated and comma-separated options")
		void shouldCollectSkippedChecks() {
			ParsedConfiguration config = argumentParser
				.parseAndValidate(new String[] { "--skip", "alumni, repos", "--skip", "zulip-users" });

			assertThat(config.skip).containsExactly("alumni", "repos", "zulip-users");
		}

		@Test
		@DisplayName("Should start from configured defaults")
		void shouldStartFromConfiguredDefaults() {
			defaultProperties.setStrict(true);
			defaultProperties.setSkip(List.of("repos"));

			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "--skip", "alumni" });

			assertThat(config.strict).isTrue();
			assertThat(config.skip).containsExactly("repos", "alumni");
		}

	}

	@Nested
	@DisplayName("Validation Tests")
	class ValidationTest {

		@Test
		@DisplayName("Should reject unknown check names")
		void shouldRejectUnknownCheck() {
			assertThatIllegalArgumentException()
				.isThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--skip", "nope" }))
				.withMessage("Configuration validation failed:\n"
						+ "  - Unknown check: nope (use --list-checks to see the available checks)");
		}

		@Test
		@DisplayName("Should accept names from a custom registry")
		void shouldAcceptCustomCheckNames() {
			ArgumentParser parser = new ArgumentParser(defaultProperties, CheckRegistry.defaults().names());

			assertThatCode(() -> parser.parseAndValidate(new String[] { "--skip", "github-usernames" }))
				.doesNotThrowAnyException();
		}

		@Test
		@DisplayName("Should reject an empty data file")
		void shouldRejectEmptyDataFile() {
			assertThatIllegalArgumentException()
				.isThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--data", " " }))
				.withMessageContaining("Data file cannot be empty");
		}

		@Test
		@DisplayName("Should reject unknown options and stray arguments")
		void shouldRejectUnknownArguments() {
			assertThatIllegalArgumentException()
				.isThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--dry-run" }))
				.withMessage("Unknown option: --dry-run");
			assertThatIllegalArgumentException()
				.isThrownBy(() -> argumentParser.parseAndValidate(new String[] { "teams.json" }))
				.withMessage("Unexpected argument: teams.json");
		}

		@Test
		@DisplayName("Should reject an option without its value")
		void shouldRejectMissingValue() {
			assertThatIllegalArgumentException()
				.isThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--skip" }))
				.withMessage("Missing value for skip option");
		}

	}

	@Nested
	@DisplayName("Help Tests")
	class HelpTest {

		@Test
		@DisplayName("Should detect help anywhere in the arguments")
		void shouldDetectHelp() {
			assertThat(argumentParser.isHelpRequested(new String[] { "--strict", "-h" })).isTrue();
			assertThat(argumentParser.isHelpRequested(new String[] { "--strict" })).isFalse();
		}

		@Test
		@DisplayName("Should describe every option")
		void shouldDescribeOptions() {
			String help = argumentParser.generateHelpText();

			assertThat(help).startsWith("Usage: team-validator [OPTIONS]")
				.contains("--data FILE", "--strict", "--skip", "--list-checks", "--verbose", "GITHUB_TOKEN",
						"ZULIP_TOKEN", "(default: team-data.json)");
		}

	}

}
