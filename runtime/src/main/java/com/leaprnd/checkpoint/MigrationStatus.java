package com.leaprnd.checkpoint;

import java.util.List;

/**
 * @param executed identifiers recorded in the ledger, in the order they were applied
 * @param pending  available identifiers that are not recorded, in the order {@code up} would apply them
 * @param missing  recorded identifiers whose migration is no longer available, in ledger order
 */
public record MigrationStatus(List<String> executed, List<String> pending, List<String> missing) {

	public MigrationStatus {
		executed = List.copyOf(executed);
		pending = List.copyOf(pending);
		missing = List.copyOf(missing);
	}

	public boolean isUpToDate() {
		return pending.isEmpty();
	}

	public boolean isConsistent() {
		return missing.isEmpty();
	}

}
