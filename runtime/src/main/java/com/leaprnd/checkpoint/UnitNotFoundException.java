package com.leaprnd.checkpoint;

import static java.lang.String.format;

public class UnitNotFoundException extends CheckpointException {

	private final String identifier;

	public UnitNotFoundException(String identifier) {
		this.identifier = identifier;
	}

	public String getIdentifier() {
		return identifier;
	}

	@Override
	public String getMessage() {
		return format("Cannot find migration %s!", identifier);
	}

}
