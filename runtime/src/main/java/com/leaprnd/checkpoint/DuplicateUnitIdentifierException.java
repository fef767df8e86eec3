package com.leaprnd.checkpoint;

import static java.lang.String.format;

public class DuplicateUnitIdentifierException extends CheckpointException {

	private final String identifier;
	private final String source;
	private final String conflictingSource;

	public DuplicateUnitIdentifierException(String identifier, String source, String conflictingSource) {
		this.identifier = identifier;
		this.source = source;
		this.conflictingSource = conflictingSource;
	}

	public String getIdentifier() {
		return identifier;
	}

	@Override
	public String getMessage() {
		return format("%s and %s are both registered as %s", source, conflictingSource, identifier);
	}

}
