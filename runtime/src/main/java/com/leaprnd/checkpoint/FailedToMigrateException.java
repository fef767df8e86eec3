package com.leaprnd.checkpoint;

import static com.leaprnd.checkpoint.ExecutionDirection.FORWARD;
import static java.lang.String.format;

public class FailedToMigrateException extends CheckpointException {

	private final String identifier;
	private final ExecutionDirection direction;
	private final boolean ledgerInconsistent;

	public FailedToMigrateException(String identifier, ExecutionDirection direction, RuntimeException cause) {
		this(identifier, direction, false, cause);
	}

	public FailedToMigrateException(String identifier, ExecutionDirection direction, boolean ledgerInconsistent, RuntimeException cause) {
		super(cause);
		this.identifier = identifier;
		this.direction = direction;
		this.ledgerInconsistent = ledgerInconsistent;
	}

	public String getIdentifier() {
		return identifier;
	}

	public ExecutionDirection getDirection() {
		return direction;
	}

	/**
	 * Whether the migration's own statements completed but the ledger could not be updated afterwards. The database
	 * then has to be inspected by hand: re-running is only safe if the migration is idempotent.
	 */
	public boolean isLedgerInconsistent() {
		return ledgerInconsistent;
	}

	/**
	 * Whether another process recorded the same migration while this one was running it.
	 */
	public boolean isRecordedConcurrently() {
		return getCause() instanceof DuplicateEntryException;
	}

	@Override
	public String getMessage() {
		if (getCause() instanceof final DuplicateEntryException duplicate) {
			return format(
				"%s ran %s successfully but another process recorded it in %s first; its statements may have run twice",
				identifier,
				direction.getOperationName(),
				duplicate.getTableName()
			);
		}
		final var cause = getCause().getMessage() == null ? getCause().toString() : getCause().getMessage();
		if (ledgerInconsistent) {
			return format(
				"%s ran %s successfully but the ledger was not updated (%s); its effects are %s but %s",
				identifier,
				direction.getOperationName(),
				cause,
				direction == FORWARD ? "applied" : "reverted",
				direction == FORWARD ? "it is not recorded as applied" : "it is still recorded as applied"
			);
		}
		return format("Failed to migrate %s %s: %s", direction.getOperationName(), identifier, cause);
	}

}
