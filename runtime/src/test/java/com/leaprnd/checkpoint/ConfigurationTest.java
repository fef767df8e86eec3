package com.leaprnd.checkpoint;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static com.leaprnd.checkpoint.DatabaseType.MYSQL;
import static com.leaprnd.checkpoint.DatabaseType.POSTGRES;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConfigurationTest {

	private static final DatabaseConfiguration DATABASE = new DatabaseConfiguration(POSTGRES, "db", 5433, "root", "secret", "app");

	@Test
	public void testValidTableName() {
		assertDoesNotThrow(() -> new Configuration(DATABASE, Path.of("migrations"), "valid_name"));
	}

	@Test
	public void testInvalidTableName() {
		final var exception = assertThrows(
			ConfigurationException.class,
			() -> new Configuration(DATABASE, Path.of("migrations"), "bad-name")
		);
		assertEquals(
			"Invalid table name. Must start with a letter or underscore and contain only alphanumeric characters and underscores",
			exception.getMessage()
		);
	}

	@Test
	public void testMissingFields() {
		assertEquals(
			"Database configuration is required",
			assertThrows(ConfigurationException.class, () -> new Configuration(null, Path.of("m"), "t")).getMessage()
		);
		assertEquals(
			"Migrations directory is required",
			assertThrows(ConfigurationException.class, () -> new Configuration(DATABASE, null, "t")).getMessage()
		);
		assertEquals(
			"Table name is required",
			assertThrows(ConfigurationException.class, () -> new Configuration(DATABASE, Path.of("m"), "")).getMessage()
		);
	}

	@Test
	public void testDefaults() {
		final var configuration = new Configuration(new DatabaseConfiguration(MYSQL, null, 0, "root", null, "app"));
		assertEquals("schema_migrations", configuration.tableName());
		assertEquals(Path.of("migrations"), configuration.migrationsDir());
		assertEquals("localhost", configuration.database().host());
		assertEquals(3306, configuration.database().port());
		assertEquals("", configuration.database().password());
	}

	@Test
	public void testJdbcUrls() {
		assertEquals("jdbc:postgresql://db:5433/app", DATABASE.getJdbcUrl());
		assertEquals(
			"jdbc:mysql://localhost:3306/app",
			new DatabaseConfiguration(MYSQL, "localhost", 0, "root", "", "app").getJdbcUrl()
		);
	}

	@Test
	public void testToStringOmitsPassword() {
		assertEquals("postgres://root@db:5433/app", DATABASE.toString());
	}

	@Test
	public void testDatabaseTypes() {
		assertEquals(POSTGRES, DatabaseType.fromName("postgres"));
		assertEquals(MYSQL, DatabaseType.fromName("mysql"));
		final var exception = assertThrows(ConfigurationException.class, () -> DatabaseType.fromName("mongodb"));
		assertEquals("Unsupported database type: mongodb. Supported types: postgres, mysql", exception.getMessage());
		assertFalse(POSTGRES.hasBackslashEscapes());
		assertTrue(MYSQL.hasBackslashEscapes());
	}

	@Test
	public void testAdapterIsSelectedByType() {
		assertInstanceOf(PostgreSQLAdapter.class, POSTGRES.createAdapter(DATABASE));
		assertInstanceOf(MySQLAdapter.class, MYSQL.createAdapter(DATABASE));
	}

	@Test
	public void testInvalidPort() {
		assertThrows(ConfigurationException.class, () -> new DatabaseConfiguration(POSTGRES, "db", 70000, "root", "", "app"));
	}

	@Test
	public void testMissingDatabaseName() {
		assertThrows(ConfigurationException.class, () -> new DatabaseConfiguration(POSTGRES, "db", 0, "root", "", " "));
	}

}
