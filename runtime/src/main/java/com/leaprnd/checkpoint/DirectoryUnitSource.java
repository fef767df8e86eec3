package com.leaprnd.checkpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.leaprnd.checkpoint.Migration.isValidIdentifier;
import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.sort;
import static java.util.Collections.unmodifiableList;

/**
 * Discovers {@link SQLScript} migrations named {@code {identifier}.sql} in a single directory. Subdirectories are not
 * scanned.
 */
public class DirectoryUnitSource implements UnitSource {

	private static final Logger LOG = LoggerFactory.getLogger(DirectoryUnitSource.class);

	public static final String EXTENSION = ".sql";

	private final Path directory;
	private final boolean backslashEscapes;

	public DirectoryUnitSource(Path directory) {
		this(directory, false);
	}

	/**
	 * @param backslashEscapes whether string literals in the scripts use backslash escapes, see {@link SQLScript}
	 */
	public DirectoryUnitSource(Path directory, boolean backslashEscapes) {
		this.directory = directory;
		this.backslashEscapes = backslashEscapes;
	}

	public Path getDirectory() {
		return directory;
	}

	public Path getPathOf(String identifier) {
		return directory.resolve(identifier + EXTENSION);
	}

	@Override
	public List<String> getIdentifiers() {
		if (!Files.isDirectory(directory)) {
			throw new MissingMigrationsDirectoryException(directory);
		}
		final var identifiers = new ArrayList<String>();
		try (final var paths = Files.list(directory)) {
			for (final var path : (Iterable<Path>) paths::iterator) {
				final var fileName = path.getFileName().toString();
				if (!fileName.endsWith(EXTENSION) || !Files.isRegularFile(path)) {
					continue;
				}
				final var identifier = fileName.substring(0, fileName.length() - EXTENSION.length());
				if (isValidIdentifier(identifier)) {
					identifiers.add(identifier);
				} else {
					LOG.warn("Skipping {}: file name is not of the form {14 digit timestamp}_{name}{}", path, EXTENSION);
				}
			}
		} catch (IOException exception) {
			throw new UnitSourceException(directory, exception);
		}
		sort(identifiers);
		return unmodifiableList(identifiers);
	}

	@Override
	public SQLScript load(String identifier) {
		if (!isValidIdentifier(identifier)) {
			throw new UnitNotFoundException(identifier);
		}
		final var path = getPathOf(identifier);
		final String text;
		try {
			text = Files.readString(path, UTF_8);
		} catch (NoSuchFileException exception) {
			throw new UnitNotFoundException(identifier);
		} catch (IOException exception) {
			throw new UnitSourceException(path, exception);
		}
		try {
			return SQLScript.parse(text, backslashEscapes);
		} catch (IllegalArgumentException exception) {
			throw new ValidationException(format("%s is not a valid migration: %s", path, exception.getMessage()), exception);
		}
	}

}
