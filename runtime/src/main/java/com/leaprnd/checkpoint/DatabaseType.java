package com.leaprnd.checkpoint;

import java.util.Arrays;
import java.util.function.Function;

import static java.lang.String.format;
import static java.util.stream.Collectors.joining;

public enum DatabaseType {

	POSTGRES("postgres", 5432, false, PostgreSQLAdapter::new),
	MYSQL("mysql", 3306, true, MySQLAdapter::new);

	public static DatabaseType fromName(String name) {
		for (final var type : values()) {
			if (type.name.equals(name)) {
				return type;
			}
		}
		final var supported = Arrays.stream(values()).map(DatabaseType::getName).collect(joining(", "));
		throw new ConfigurationException(format("Unsupported database type: %s. Supported types: %s", name, supported));
	}

	private final String name;
	private final int defaultPort;
	private final boolean backslashEscapes;
	private final Function<DatabaseConfiguration, Adapter> adapterFactory;

	DatabaseType(String name, int defaultPort, boolean backslashEscapes, Function<DatabaseConfiguration, Adapter> adapterFactory) {
		this.name = name;
		this.defaultPort = defaultPort;
		this.backslashEscapes = backslashEscapes;
		this.adapterFactory = adapterFactory;
	}

	public String getName() {
		return name;
	}

	public int getDefaultPort() {
		return defaultPort;
	}

	/**
	 * Whether a backslash escapes the next character in every string literal of this dialect.
	 */
	public boolean hasBackslashEscapes() {
		return backslashEscapes;
	}

	public Adapter createAdapter(DatabaseConfiguration configuration) {
		return adapterFactory.apply(configuration);
	}

}
