package com.leaprnd.checkpoint;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.TreeMap;

import static com.leaprnd.checkpoint.Migration.getManifestNameOf;
import static com.leaprnd.checkpoint.Migration.isValidIdentifier;
import static java.lang.String.format;
import static java.util.Collections.unmodifiableList;

/**
 * Migrations compiled into the application, either registered by hand or listed in the manifests that the
 * {@code @Migrate} annotation processor writes for each group. Adding one of these requires recompiling, unlike a
 * {@link DirectoryUnitSource}.
 */
public class RegisteredUnitSource implements UnitSource {

	public static RegisteredUnitSource fromClassPath() {
		return fromClassPath(Migration.DEFAULT_GROUP);
	}

	public static RegisteredUnitSource fromClassPath(String group) {
		return fromClassPath(group, Thread.currentThread().getContextClassLoader());
	}

	public static RegisteredUnitSource fromClassPath(String group, ClassLoader classLoader) {
		final var source = new RegisteredUnitSource();
		try {
			final var resources = classLoader.getResources(getManifestNameOf(group));
			while (resources.hasMoreElements()) {
				final var resource = resources.nextElement();
				try (final var inputStream = new DataInputStream(resource.openStream())) {
					while (true) {
						final String id;
						try {
							id = inputStream.readUTF();
						} catch (EOFException exception) {
							break;
						}
						final var className = inputStream.readUTF();
						source.register(id, instantiate(className, classLoader), className);
					}
				}
			}
		} catch (IOException exception) {
			throw new UnitSourceException(getManifestNameOf(group), exception);
		}
		return source;
	}

	private static Migration instantiate(String className, ClassLoader classLoader) {
		try {
			final var object = Class.forName(className, true, classLoader).getConstructor().newInstance();
			if (object instanceof final Migration migration) {
				return migration;
			}
			throw new MissingMigrationException(className, new ClassCastException(className + " is not a Migration"));
		} catch (ReflectiveOperationException | LinkageError exception) {
			throw new MissingMigrationException(className, exception);
		}
	}

	private final TreeMap<String, Migration> migrationsById = new TreeMap<>();
	private final HashMap<String, String> sourcesById = new HashMap<>();

	public RegisteredUnitSource register(String identifier, Migration migration) {
		return register(identifier, migration, migration.getClass().getName());
	}

	private RegisteredUnitSource register(String identifier, Migration migration, String source) {
		if (!isValidIdentifier(identifier)) {
			throw new ValidationException(format("\"%s\" is not of the form {14 digit timestamp}_{name}", identifier));
		}
		final var conflictingSource = sourcesById.putIfAbsent(identifier, source);
		if (conflictingSource != null) {
			throw new DuplicateUnitIdentifierException(identifier, source, conflictingSource);
		}
		migrationsById.put(identifier, migration);
		return this;
	}

	@Override
	public List<String> getIdentifiers() {
		return unmodifiableList(new ArrayList<>(migrationsById.keySet()));
	}

	@Override
	public Migration load(String identifier) {
		final var migration = migrationsById.get(identifier);
		if (migration == null) {
			throw new UnitNotFoundException(identifier);
		}
		return migration;
	}

}
