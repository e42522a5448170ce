package org.springaicommunity.team.validator;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a JSON snapshot of the team data into an {@link InMemoryTeamData}.
 */
public class TeamDataLoader {

	private static final Logger logger = LoggerFactory.getLogger(TeamDataLoader.class);

	private final ObjectMapper objectMapper;

	public TeamDataLoader(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Load a snapshot file.
	 * @param file path of the JSON snapshot
	 * @return the loaded data
	 * @throws TeamDataException if the file cannot be read or does not describe a
	 * consistent data set
	 */
	public TeamData load(Path file) throws TeamDataException {
		if (!Files.isRegularFile(file)) {
			throw new TeamDataException("team data file not found: " + file);
		}
		try (InputStream in = Files.newInputStream(file)) {
			TeamData data = load(in);
			logger.info("Loaded {} teams, {} archived teams, {} people and {} repos from {}", data.teams().size(),
					data.archivedTeams().size(), data.people().size(), data.repos().size(), file);
			return data;
		}
		catch (IOException e) {
			throw new TeamDataException("failed to read " + file + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Load a snapshot from a stream. The stream is not closed.
	 * @param in JSON snapshot
	 * @return the loaded data
	 * @throws TeamDataException if the JSON is malformed or a team or person is declared
	 * twice
	 */
	public TeamData load(InputStream in) throws TeamDataException {
		TeamDataSnapshot snapshot;
		try {
			snapshot = objectMapper.readValue(in, TeamDataSnapshot.class);
		}
		catch (IOException e) {
			throw new TeamDataException("malformed team data: " + e.getMessage(), e);
		}
		try {
			return snapshot.toTeamData();
		}
		catch (IllegalArgumentException e) {
			throw new TeamDataException("inconsistent team data: " + e.getMessage(), e);
		}
	}

}
