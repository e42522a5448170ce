package org.springaicommunity.team.validator.cli;

import org.springaicommunity.team.validator.ArgumentParser;
import org.springaicommunity.team.validator.TeamDataLoader;
import org.springaicommunity.team.validator.TeamValidator;
import org.springaicommunity.team.validator.ValidatorConfig;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * Team Validator Spring Boot Application
 *
 * Spring Boot command-line application running the same validation as
 * {@link TeamValidatorCli}, with the validator wired by {@link ValidatorConfig}.
 * Credentials can also be supplied as Spring properties.
 */
@SpringBootApplication
@Import(ValidatorConfig.class)
public class TeamValidatorApp implements CommandLineRunner, ExitCodeGenerator {

	private final ArgumentParser argumentParser;

	private final TeamDataLoader teamDataLoader;

	private final TeamValidator teamValidator;

	private int exitCode = ValidationCommand.EXIT_OK;

	public TeamValidatorApp(ArgumentParser argumentParser, TeamDataLoader teamDataLoader,
			TeamValidator teamValidator) {
		this.argumentParser = argumentParser;
		this.teamDataLoader = teamDataLoader;
		this.teamValidator = teamValidator;
	}

	public static void main(String[] args) {
		// Configure Spring Boot to run as console application
		SpringApplication app = new SpringApplication(TeamValidatorApp.class);
		app.setWebApplicationType(WebApplicationType.NONE);
		System.exit(SpringApplication.exit(app.run(args)));
	}

	@Override
	public void run(String... args) {
		exitCode = new ValidationCommand(argumentParser, teamDataLoader, teamValidator, System.out).execute(args);
	}

	@Override
	public int getExitCode() {
		return exitCode;
	}

}
