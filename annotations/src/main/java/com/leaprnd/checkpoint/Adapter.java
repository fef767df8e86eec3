package com.leaprnd.checkpoint;

import org.intellij.lang.annotations.Language;

import java.util.List;

/**
 * A connection to one backing store. Migrations only ever see this interface, so they stay portable across the
 * supported databases as long as the SQL they issue does.
 *
 * <p>The ledger primitives interpolate {@code tableName} into SQL, so callers must only pass names that have already
 * been validated as plain identifiers.</p>
 */
public interface Adapter extends AutoCloseable {

	/**
	 * Opens the underlying connection. Calling it on an adapter that is already connected does nothing.
	 *
	 * @throws ConnectionException if the database is unreachable or rejects the credentials
	 */
	void connect();

	/**
	 * @throws ExecutionFailedException if the statement fails
	 */
	void execute(@Language("SQL") String sql);

	void createLedgerTable(String tableName);

	/**
	 * @return identifiers in the order they were applied; empty if nothing has been applied yet
	 */
	List<String> listLedgerEntries(String tableName);

	/**
	 * @throws DuplicateEntryException if {@code identifier} is already recorded
	 */
	void insertLedgerEntry(String tableName, String identifier);

	void deleteLedgerEntry(String tableName, String identifier);

	@Override
	void close();

}
