package com.leaprnd.checkpoint;

import java.sql.SQLException;

import static java.lang.String.format;

public class DuplicateEntryException extends ExecutionFailedException {

	private final String tableName;
	private final String identifier;

	public DuplicateEntryException(String tableName, String identifier, String sql, SQLException cause) {
		super(sql, cause);
		this.tableName = tableName;
		this.identifier = identifier;
	}

	public String getTableName() {
		return tableName;
	}

	public String getIdentifier() {
		return identifier;
	}

	@Override
	public String getMessage() {
		return format("%s is already recorded in %s", identifier, tableName);
	}

}
