package com.leaprnd.checkpoint;

import java.io.IOException;
import java.nio.file.Path;

import static java.lang.String.format;

public class UnitSourceException extends CheckpointException {

	private final String location;

	public UnitSourceException(Path path, IOException cause) {
		this(path.toString(), cause);
	}

	public UnitSourceException(String location, IOException cause) {
		super(cause);
		this.location = location;
	}

	public String getLocation() {
		return location;
	}

	@Override
	public String getMessage() {
		return format("Cannot read migrations from %s: %s", location, getCause().getMessage());
	}

}
