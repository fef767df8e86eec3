package com.leaprnd.checkpoint;

public abstract class CheckpointException extends RuntimeException {

	protected CheckpointException() {}

	protected CheckpointException(Throwable cause) {
		super(cause);
	}

}
