package com.leaprnd.checkpoint;

import java.nio.file.Path;

import static java.lang.String.format;

public class MissingMigrationsDirectoryException extends CheckpointException {

	private final Path directory;

	public MissingMigrationsDirectoryException(Path directory) {
		this.directory = directory;
	}

	public Path getDirectory() {
		return directory;
	}

	@Override
	public String getMessage() {
		return format("Migrations directory not found: %s", directory);
	}

}
