package com.leaprnd.checkpoint;

import java.util.List;

import static com.leaprnd.checkpoint.Configuration.validateTableName;
import static java.util.Collections.unmodifiableList;

/**
 * The record, kept in the target database itself, of which migrations have been applied and in what order.
 */
public class Ledger {

	private final Adapter adapter;
	private final String tableName;

	public Ledger(Adapter adapter, String tableName) {
		this.adapter = adapter;
		this.tableName = validateTableName(tableName);
	}

	public String getTableName() {
		return tableName;
	}

	public void ensureTable() {
		adapter.createLedgerTable(tableName);
	}

	public List<String> list() {
		return unmodifiableList(adapter.listLedgerEntries(tableName));
	}

	public void record(String identifier) {
		adapter.insertLedgerEntry(tableName, identifier);
	}

	public void remove(String identifier) {
		adapter.deleteLedgerEntry(tableName, identifier);
	}

}
