package com.leaprnd.checkpoint;

public enum ExecutionDirection {

	FORWARD("up"),
	BACKWARD("down");

	private final String operationName;

	ExecutionDirection(String operationName) {
		this.operationName = operationName;
	}

	public String getOperationName() {
		return operationName;
	}

}
