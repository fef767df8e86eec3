package com.leaprnd.checkpoint;

import static java.lang.String.format;

public class ConnectionException extends CheckpointException {

	private final String databaseName;

	public ConnectionException(String databaseName, Throwable cause) {
		super(cause);
		this.databaseName = databaseName;
	}

	public String getDatabaseName() {
		return databaseName;
	}

	@Override
	public String getMessage() {
		return format("%s connection failed: %s", databaseName, getCause().getMessage());
	}

}
