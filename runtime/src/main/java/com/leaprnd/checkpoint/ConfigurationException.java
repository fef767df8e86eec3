package com.leaprnd.checkpoint;

public class ConfigurationException extends CheckpointException {

	private final String reason;

	public ConfigurationException(String reason) {
		this.reason = reason;
	}

	public ConfigurationException(String reason, Throwable cause) {
		super(cause);
		this.reason = reason;
	}

	@Override
	public String getMessage() {
		return reason;
	}

}
