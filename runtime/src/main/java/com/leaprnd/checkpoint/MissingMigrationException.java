package com.leaprnd.checkpoint;

import static java.lang.String.format;

public class MissingMigrationException extends CheckpointException {

	private final String className;

	public MissingMigrationException(String className, Throwable cause) {
		super(cause);
		this.className = className;
	}

	public String getClassName() {
		return className;
	}

	@Override
	public String getMessage() {
		return format("Cannot instantiate class listed in manifest: %s!", className);
	}

}
