package org.springaicommunity.team.validator.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.team.validator.ArgumentParser;
import org.springaicommunity.team.validator.TeamValidatorBuilder;

/**
 * Team Validator CLI Application
 *
 * Plain Java command-line application that checks a team data snapshot. No Spring
 * dependencies - uses TeamValidatorBuilder for service wiring.
 *
 * Usage: java -jar team-validator-cli.jar [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN - enables the GitHub checks; ZULIP_USERNAME and
 * ZULIP_TOKEN - enable the Zulip checks
 *
 * Exit codes: 0 when the data is valid, 1 when violations were found or the run failed,
 * 2 on invalid arguments.
 */
public class TeamValidatorCli {

	private static final Logger logger = LoggerFactory.getLogger(TeamValidatorCli.class);

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (RuntimeException e) {
			logger.error("Validation failed: {}", e.getMessage());
			System.exit(ValidationCommand.EXIT_FAILED);
		}
	}

	public static int run(String[] args) {
		return run(args, TeamValidatorBuilder.create().credentialsFromEnv());
	}

	static int run(String[] args, TeamValidatorBuilder builder) {
		ArgumentParser argumentParser = new ArgumentParser(builder.getProperties());
		ValidationCommand command = new ValidationCommand(argumentParser, builder.buildLoader(),
				builder.buildValidator(), System.out);
		return command.execute(args);
	}

}
