package com.leaprnd.checkpoint;

import java.nio.file.Path;
import java.util.regex.Pattern;

public record Configuration(DatabaseConfiguration database, Path migrationsDir, String tableName) {

	public static final String DEFAULT_TABLE_NAME = "schema_migrations";
	public static final Path DEFAULT_MIGRATIONS_DIR = Path.of("migrations");

	private static final Pattern TABLE_NAME_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

	public static String validateTableName(String tableName) {
		if (tableName == null || tableName.isEmpty()) {
			throw new ConfigurationException("Table name is required");
		}
		if (!TABLE_NAME_PATTERN.matcher(tableName).matches()) {
			throw new ConfigurationException(
				"Invalid table name. Must start with a letter or underscore and contain only alphanumeric characters and underscores"
			);
		}
		return tableName;
	}

	public Configuration {
		if (database == null) {
			throw new ConfigurationException("Database configuration is required");
		}
		if (migrationsDir == null) {
			throw new ConfigurationException("Migrations directory is required");
		}
		validateTableName(tableName);
	}

	public Configuration(DatabaseConfiguration database) {
		this(database, DEFAULT_MIGRATIONS_DIR, DEFAULT_TABLE_NAME);
	}

}
