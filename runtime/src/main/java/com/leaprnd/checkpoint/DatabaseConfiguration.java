package com.leaprnd.checkpoint;

import static java.lang.String.format;

public record DatabaseConfiguration(DatabaseType type, String host, int port, String user, String password, String database) {

	public static final String DEFAULT_HOST = "localhost";

	public DatabaseConfiguration {
		if (type == null) {
			throw new ConfigurationException("Database type is required");
		}
		if (host == null || host.isBlank()) {
			host = DEFAULT_HOST;
		}
		if (port == 0) {
			port = type.getDefaultPort();
		} else if (port < 0 || port > 65535) {
			throw new ConfigurationException(format("Invalid database port: %d", port));
		}
		if (database == null || database.isBlank()) {
			throw new ConfigurationException("Database name is required");
		}
		if (password == null) {
			password = "";
		}
	}

	public String getJdbcUrl() {
		return switch (type) {
			case POSTGRES -> format("jdbc:postgresql://%s:%d/%s", host, port, database);
			case MYSQL -> format("jdbc:mysql://%s:%d/%s", host, port, database);
		};
	}

	@Override
	public String toString() {
		return format("%s://%s@%s:%d/%s", type.getName(), user, host, port, database);
	}

}
