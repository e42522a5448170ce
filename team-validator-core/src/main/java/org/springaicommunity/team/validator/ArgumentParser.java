package org.springaicommunity.team.validator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Command-line argument parser for the team data validator. Pure Java implementation with
 * no Spring dependencies for maximum testability.
 */
public class ArgumentParser {

	private final ValidatorProperties defaultProperties;

	private final Set<String> checkNames;

	public ArgumentParser(ValidatorProperties defaultProperties) {
		this(defaultProperties, CheckRegistry.defaults().names());
	}

	/**
	 * Create a parser.
	 * @param defaultProperties values used for options that are not given
	 * @param checkNames names accepted by {@code --skip}
	 */
	public ArgumentParser(ValidatorProperties defaultProperties, Set<String> checkNames) {
		this.defaultProperties = defaultProperties;
		this.checkNames = checkNames;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-d", "--data":
					config.dataFile = getRequiredValue(args, i, "data");
					i++;
					break;

				case "--strict":
					config.strict = true;
					break;

				case "--skip":
					String skipStr = getRequiredValue(args, i, "skip");
					Arrays.stream(skipStr.split(","))
						.map(String::trim)
						.filter(s -> !s.isEmpty())
						.forEach(config.skip::add);
					i++;
					break;

				case "--list-checks":
					config.listChecks = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: team-validator [OPTIONS]\n");
		help.append("\n");
		help.append("Check the consistency of the team, people, repository and mailing list data.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -d, --data FILE         JSON snapshot of the team data (default: ")
			.append(defaultProperties.getDataFile())
			.append(")\n");
		help.append("    --strict                Fail when the GitHub API cannot be used\n");
		help.append("    --skip CHECK[,CHECK]    Do not run the named checks (repeatable)\n");
		help.append("    --list-checks           Print the names of all checks and exit\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN            GitHub token, enables the GitHub checks\n");
		help.append("    ZULIP_USERNAME          Zulip bot email, enables the Zulip checks with ZULIP_TOKEN\n");
		help.append("    ZULIP_TOKEN             Zulip bot API key\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    team-validator --data team-data.json\n");
		help.append("    team-validator --strict --skip inactive-members,zulip-users\n");
		help.append("\n");
		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.dataFile == null || config.dataFile.trim().isEmpty()) {
			errors.add("Data file cannot be empty");
		}

		for (String name : config.skip) {
			if (!checkNames.contains(name)) {
				errors.add("Unknown check: " + name + " (use --list-checks to see the available checks)");
			}
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
