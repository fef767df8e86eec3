package com.leaprnd.checkpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.WRITE;

/**
 * Reads a {@link Configuration} from a properties file. Environment variables take precedence over the values in the
 * file, so the same file can be shared between environments.
 */
public class ConfigurationLoader {

	private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLoader.class);

	public static final String DEFAULT_FILE_NAME = "migration.properties";

	public static final String DATABASE_TYPE = "database.type";
	public static final String DATABASE_HOST = "database.host";
	public static final String DATABASE_PORT = "database.port";
	public static final String DATABASE_USER = "database.user";
	public static final String DATABASE_PASSWORD = "database.password";
	public static final String DATABASE_NAME = "database.name";
	public static final String MIGRATIONS_DIR = "migrationsDir";
	public static final String TABLE_NAME = "tableName";

	private static final Map<String, String> ENVIRONMENT_VARIABLES_BY_KEY = Map.of(
		DATABASE_TYPE, "DB_TYPE",
		DATABASE_HOST, "DB_HOST",
		DATABASE_PORT, "DB_PORT",
		DATABASE_USER, "DB_USER",
		DATABASE_PASSWORD, "DB_PASSWORD",
		DATABASE_NAME, "DB_NAME",
		MIGRATIONS_DIR, "MIGRATIONS_DIR"
	);

	private static final String TEMPLATE = """
		# Database connection. Each value can be overridden by the environment variable named beside it.
		# database.type: postgres or mysql (DB_TYPE)
		database.type=postgres
		# DB_HOST
		database.host=localhost
		# DB_PORT: 5432 for postgres, 3306 for mysql
		database.port=5432
		# DB_USER
		database.user=root
		# DB_PASSWORD
		database.password=
		# DB_NAME
		database.name=mydb

		# Directory containing migration files (MIGRATIONS_DIR)
		migrationsDir=./migrations

		# Name of the table used to track migrations
		tableName=schema_migrations
		""";

	private final Map<String, String> environment;

	public ConfigurationLoader() {
		this(System.getenv());
	}

	public ConfigurationLoader(Map<String, String> environment) {
		this.environment = environment;
	}

	public Configuration load(Path file) {
		final var properties = new Properties();
		try (final Reader reader = Files.newBufferedReader(file, UTF_8)) {
			properties.load(reader);
		} catch (NoSuchFileException exception) {
			throw new ConfigurationException("Config file not found. Run 'checkpoint init' first.", exception);
		} catch (IOException exception) {
			throw new ConfigurationException(format("Cannot read %s: %s", file, exception.getMessage()), exception);
		}
		return load(properties);
	}

	public Configuration load(Properties properties) {
		final var type = get(properties, DATABASE_TYPE);
		if (type == null) {
			throw new ConfigurationException("Database configuration is required");
		}
		final var database = new DatabaseConfiguration(
			DatabaseType.fromName(type),
			get(properties, DATABASE_HOST),
			parsePort(get(properties, DATABASE_PORT)),
			get(properties, DATABASE_USER),
			get(properties, DATABASE_PASSWORD),
			get(properties, DATABASE_NAME)
		);
		final var migrationsDir = get(properties, MIGRATIONS_DIR);
		final var tableName = get(properties, TABLE_NAME);
		return new Configuration(
			database,
			migrationsDir == null ? Configuration.DEFAULT_MIGRATIONS_DIR : Path.of(migrationsDir),
			tableName == null ? Configuration.DEFAULT_TABLE_NAME : tableName
		);
	}

	/**
	 * Writes a default configuration file unless one already exists.
	 *
	 * @return whether a file was written
	 */
	public boolean scaffold(Path file) {
		try {
			Files.writeString(file, TEMPLATE, UTF_8, CREATE_NEW, WRITE);
			LOG.info("Created {}", file);
			return true;
		} catch (FileAlreadyExistsException exception) {
			LOG.debug("Keeping existing {}", file);
			return false;
		} catch (IOException exception) {
			throw new ConfigurationException(format("Cannot write %s: %s", file, exception.getMessage()), exception);
		}
	}

	private String get(Properties properties, String key) {
		final var variable = ENVIRONMENT_VARIABLES_BY_KEY.get(key);
		if (variable != null) {
			final var value = environment.get(variable);
			if (value != null && !value.isEmpty()) {
				return value;
			}
		}
		final var value = properties.getProperty(key);
		if (value == null || value.isBlank()) {
			return null;
		}
		return value.strip();
	}

	private static int parsePort(String port) {
		if (port == null) {
			return 0;
		}
		try {
			return Integer.parseInt(port);
		} catch (NumberFormatException exception) {
			throw new ConfigurationException(format("Invalid database port: %s", port), exception);
		}
	}

}
