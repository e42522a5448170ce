package org.springaicommunity.team.validator.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.team.validator.ArgumentParser;
import org.springaicommunity.team.validator.DirectoryException;
import org.springaicommunity.team.validator.ParsedConfiguration;
import org.springaicommunity.team.validator.TeamData;
import org.springaicommunity.team.validator.TeamDataException;
import org.springaicommunity.team.validator.TeamDataLoader;
import org.springaicommunity.team.validator.TeamValidator;
import org.springaicommunity.team.validator.ValidationFailedException;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * One validator invocation: parse the arguments, load the snapshot, run the checks and
 * map the outcome to a process exit code. Shared by the plain Java and the Spring Boot
 * entry points.
 */
class ValidationCommand {

	static final int EXIT_OK = 0;

	static final int EXIT_FAILED = 1;

	static final int EXIT_USAGE = 2;

	private static final Logger logger = LoggerFactory.getLogger(ValidationCommand.class);

	private final ArgumentParser argumentParser;

	private final TeamDataLoader loader;

	private final TeamValidator validator;

	private final PrintStream out;

	ValidationCommand(ArgumentParser argumentParser, TeamDataLoader loader, TeamValidator validator, PrintStream out) {
		this.argumentParser = argumentParser;
		this.loader = loader;
		this.validator = validator;
		this.out = out;
	}

	int execute(String[] args) {
		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			logger.error("Run with --help for usage");
			return EXIT_USAGE;
		}

		if (config.listChecks) {
			validator.getRegistry().names().forEach(out::println);
			return EXIT_OK;
		}

		if (config.verbose) {
			enableVerboseLogging();
		}
		logger.debug("Configuration: {}", config);

		try {
			TeamData data = loader.load(Path.of(config.dataFile));
			validator.validate(data, config.strict, config.skip);
			return EXIT_OK;
		}
		catch (ValidationFailedException e) {
			logger.error(e.getMessage());
			return EXIT_FAILED;
		}
		catch (DirectoryException e) {
			logger.error("GitHub API unavailable in strict mode: {}", e.getMessage());
			return EXIT_FAILED;
		}
		catch (TeamDataException e) {
			logger.error("Failed to load team data: {}", e.getMessage());
			if (config.verbose) {
				logger.error("Stack trace:", e);
			}
			return EXIT_FAILED;
		}
	}

	private static void enableVerboseLogging() {
		Logger root = LoggerFactory.getLogger("org.springaicommunity.team.validator");
		if (root instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

}
