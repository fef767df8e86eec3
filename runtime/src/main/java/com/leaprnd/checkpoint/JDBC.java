package com.leaprnd.checkpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

final class JDBC {

	private static final Logger LOG = LoggerFactory.getLogger(JDBC.class);

	private JDBC() {}

	static Connection requireOpen(Connection connection) {
		if (connection == null) {
			throw new IllegalStateException("Adapter is not connected!");
		}
		return connection;
	}

	static void execute(Connection connection, String sql) {
		LOG.debug("Executing {}", sql);
		try (final var statement = requireOpen(connection).createStatement()) {
			statement.execute(sql);
		} catch (SQLException exception) {
			throw new ExecutionFailedException(sql, exception);
		}
	}

	static List<String> selectStrings(Connection connection, String sql) {
		try (final var statement = requireOpen(connection).createStatement()) {
			try (final var results = statement.executeQuery(sql)) {
				final var values = new ArrayList<String>();
				while (results.next()) {
					values.add(results.getString(1));
				}
				return values;
			}
		} catch (SQLException exception) {
			throw new ExecutionFailedException(sql, exception);
		}
	}

	static void update(Connection connection, String sql, String parameter) throws SQLException {
		LOG.debug("Executing {} with {}", sql, parameter);
		try (final var statement = requireOpen(connection).prepareStatement(sql)) {
			statement.setString(1, parameter);
			statement.executeUpdate();
		}
	}

	static void close(Connection connection, String databaseName) {
		if (connection == null) {
			return;
		}
		try {
			connection.close();
		} catch (SQLException exception) {
			LOG.warn("Failed to close {} connection", databaseName, exception);
		}
	}

}
