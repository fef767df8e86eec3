package com.leaprnd.checkpoint;

import java.sql.SQLException;

import static java.lang.String.format;

public class ExecutionFailedException extends CheckpointException {

	private final String sql;

	public ExecutionFailedException(String sql, SQLException cause) {
		super(cause);
		this.sql = sql;
	}

	public String getSql() {
		return sql;
	}

	@Override
	public SQLException getCause() {
		return (SQLException) super.getCause();
	}

	@Override
	public String getMessage() {
		return format("Failed to execute %s: %s", abbreviate(sql), getCause().getMessage());
	}

	private static String abbreviate(String sql) {
		final var collapsed = sql.strip().replaceAll("\\s+", " ");
		if (collapsed.length() > 80) {
			return '"' + collapsed.substring(0, 77) + "...\"";
		}
		return '"' + collapsed + '"';
	}

}
