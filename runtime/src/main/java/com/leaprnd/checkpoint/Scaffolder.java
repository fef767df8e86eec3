package com.leaprnd.checkpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.format.DateTimeFormatter;

import static com.leaprnd.checkpoint.DirectoryUnitSource.EXTENSION;
import static com.leaprnd.checkpoint.Migration.isValidName;
import static com.leaprnd.checkpoint.SQLScript.DOWN_MARKER;
import static com.leaprnd.checkpoint.SQLScript.UP_MARKER;
import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.WRITE;
import static java.time.ZoneOffset.UTC;

public class Scaffolder {

	private static final Logger LOG = LoggerFactory.getLogger(Scaffolder.class);

	private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(UTC);

	private static final String TEMPLATE = """
		-- Migration: %s
		-- Created: %s

		%s
		-- Write your migration here, for example:
		-- CREATE TABLE users (id SERIAL PRIMARY KEY, name VARCHAR(255));

		%s
		-- Write your rollback here, for example:
		-- DROP TABLE users;
		""";

	private final Path directory;
	private final Clock clock;

	public Scaffolder(Path directory) {
		this(directory, Clock.systemUTC());
	}

	public Scaffolder(Path directory, Clock clock) {
		this.directory = directory;
		this.clock = clock;
	}

	public String createIdentifier(String name) {
		if (name == null || name.isBlank()) {
			throw new ValidationException("Migration name is required");
		}
		if (!isValidName(name)) {
			throw new ValidationException("Migration name can only contain letters, numbers, and underscores");
		}
		return TIMESTAMP_FORMAT.format(clock.instant()) + '_' + name;
	}

	public Path create(String name) {
		final var identifier = createIdentifier(name);
		final var path = directory.resolve(identifier + EXTENSION);
		try {
			Files.createDirectories(directory);
			Files.writeString(path, format(TEMPLATE, name, clock.instant(), UP_MARKER, DOWN_MARKER), UTF_8, CREATE_NEW, WRITE);
		} catch (FileAlreadyExistsException exception) {
			throw new ValidationException(format("%s already exists", path), exception);
		} catch (IOException exception) {
			throw new UnitSourceException(path, exception);
		}
		LOG.info("Created {}", path);
		return path;
	}

}
