package com.leaprnd.checkpoint;

public class ValidationException extends CheckpointException {

	private final String reason;

	public ValidationException(String reason) {
		this.reason = reason;
	}

	public ValidationException(String reason, Throwable cause) {
		super(cause);
		this.reason = reason;
	}

	@Override
	public String getMessage() {
		return reason;
	}

}
