package com.leaprnd.checkpoint;

import org.intellij.lang.annotations.Language;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;

public class MySQLAdapter implements Adapter {

	private static final String DATABASE_NAME = "MySQL";
	private static final int DUPLICATE_ENTRY = 1062;

	@Language("SQL")
	private static final String SQL_TO_CREATE_LEDGER_TABLE = """
		CREATE TABLE IF NOT EXISTS %s (
			id INT AUTO_INCREMENT PRIMARY KEY,
			name VARCHAR(255) UNIQUE NOT NULL,
			executed_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
		)
		""";

	@Language("SQL")
	private static final String SQL_TO_SELECT_LEDGER_ENTRIES = """
		SELECT name FROM %s ORDER BY executed_at ASC, id ASC
		""";

	@Language("SQL")
	private static final String SQL_TO_INSERT_LEDGER_ENTRY = """
		INSERT INTO %s (name) VALUES (?)
		""";

	@Language("SQL")
	private static final String SQL_TO_DELETE_LEDGER_ENTRY = """
		DELETE FROM %s WHERE name = ?
		""";

	private final DatabaseConfiguration configuration;
	private Connection connection;

	public MySQLAdapter(DatabaseConfiguration configuration) {
		this.configuration = configuration;
	}

	@Override
	public void connect() {
		if (connection != null) {
			return;
		}
		try {
			connection = DriverManager.getConnection(configuration.getJdbcUrl(), configuration.user(), configuration.password());
		} catch (SQLException exception) {
			throw new ConnectionException(DATABASE_NAME, exception);
		}
	}

	@Override
	public void execute(String sql) {
		JDBC.execute(connection, sql);
	}

	@Override
	public void createLedgerTable(String tableName) {
		JDBC.execute(connection, SQL_TO_CREATE_LEDGER_TABLE.formatted(tableName));
	}

	@Override
	public List<String> listLedgerEntries(String tableName) {
		return JDBC.selectStrings(connection, SQL_TO_SELECT_LEDGER_ENTRIES.formatted(tableName));
	}

	@Override
	public void insertLedgerEntry(String tableName, String identifier) {
		final var sql = SQL_TO_INSERT_LEDGER_ENTRY.formatted(tableName);
		try {
			JDBC.update(connection, sql, identifier);
		} catch (SQLException exception) {
			if (exception.getErrorCode() == DUPLICATE_ENTRY) {
				throw new DuplicateEntryException(tableName, identifier, sql, exception);
			}
			throw new ExecutionFailedException(sql, exception);
		}
	}

	@Override
	public void deleteLedgerEntry(String tableName, String identifier) {
		final var sql = SQL_TO_DELETE_LEDGER_ENTRY.formatted(tableName);
		try {
			JDBC.update(connection, sql, identifier);
		} catch (SQLException exception) {
			throw new ExecutionFailedException(sql, exception);
		}
	}

	@Override
	public void close() {
		JDBC.close(connection, DATABASE_NAME);
		connection = null;
	}

}
