package com.leaprnd.checkpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static com.leaprnd.checkpoint.Configuration.validateTableName;
import static com.leaprnd.checkpoint.ExecutionDirection.BACKWARD;
import static com.leaprnd.checkpoint.ExecutionDirection.FORWARD;
import static java.util.Collections.unmodifiableList;

/**
 * Reconciles the migrations a {@link UnitSource} offers with the ones its {@link Ledger} says have been applied.
 *
 * <p>Every operation opens its own {@link Adapter} and closes it before returning, whether it succeeds or not.
 * Migrations are applied strictly one after the other, and each one is recorded before the next is loaded. There is
 * no locking between processes: if two of them migrate the same database at once, the loser fails with a
 * {@link DuplicateEntryException} when it tries to record a migration the winner already recorded.</p>
 */
public class Migrator {

	private static final Logger LOG = LoggerFactory.getLogger(Migrator.class);

	/**
	 * @return the elements of {@code available} that are not in {@code executed}, in the order of {@code available}
	 */
	public static List<String> subtract(List<String> available, Collection<String> executed) {
		final var excluded = new HashSet<>(executed);
		final var remaining = new ArrayList<String>();
		for (final var identifier : available) {
			if (!excluded.contains(identifier)) {
				remaining.add(identifier);
			}
		}
		return unmodifiableList(remaining);
	}

	private final Supplier<Adapter> adapterFactory;
	private final UnitSource unitSource;
	private final String tableName;

	public Migrator(Configuration configuration) {
		this(configuration, new DirectoryUnitSource(configuration.migrationsDir(), configuration.database().type().hasBackslashEscapes()));
	}

	public Migrator(Configuration configuration, UnitSource unitSource) {
		this(() -> configuration.database().type().createAdapter(configuration.database()), unitSource, configuration.tableName());
	}

	public Migrator(Supplier<Adapter> adapterFactory, UnitSource unitSource, String tableName) {
		this.adapterFactory = adapterFactory;
		this.unitSource = unitSource;
		this.tableName = validateTableName(tableName);
	}

	public String getTableName() {
		return tableName;
	}

	public void init() {
		try (final var adapter = connect()) {
			new Ledger(adapter, tableName).ensureTable();
		}
		if (unitSource instanceof final DirectoryUnitSource directoryUnitSource) {
			final var directory = directoryUnitSource.getDirectory();
			try {
				Files.createDirectories(directory);
			} catch (IOException exception) {
				throw new UnitSourceException(directory, exception);
			}
		}
		LOG.info("Initialized {}", tableName);
	}

	/**
	 * Applies every pending migration in ascending identifier order, stopping at the first failure.
	 *
	 * @return the identifiers that were applied, empty if there was nothing to do
	 * @throws FailedToMigrateException if a migration or the ledger update that follows it fails; the migrations
	 *                                  applied before it stay applied and recorded
	 */
	public List<String> up() {
		return up(identifier -> {});
	}

	/**
	 * Same as {@link #up()}, but tells {@code listener} about each migration as soon as it is applied and recorded, so
	 * that callers can report progress that a later failure would otherwise hide.
	 */
	public List<String> up(Consumer<String> listener) {
		try (final var adapter = connect()) {
			final var ledger = new Ledger(adapter, tableName);
			ledger.ensureTable();
			final var executed = ledger.list();
			final var available = unitSource.getIdentifiers();
			for (final var identifier : subtract(executed, available)) {
				LOG.warn("{} is recorded in {} but its migration cannot be found", identifier, tableName);
			}
			final var pending = subtract(available, executed);
			if (pending.isEmpty()) {
				LOG.info("No pending migrations");
				return List.of();
			}
			final var migrated = new ArrayList<String>(pending.size());
			for (final var identifier : pending) {
				migrateForward(adapter, ledger, identifier);
				migrated.add(identifier);
				listener.accept(identifier);
			}
			return unmodifiableList(migrated);
		}
	}

	/**
	 * Reverts the most recently applied migration, as ordered by the ledger.
	 *
	 * @return the identifier that was reverted, empty if nothing has been applied
	 * @throws UnitNotFoundException    if the migration to revert is no longer available; the ledger is left as is
	 * @throws FailedToMigrateException if the migration or the ledger update that follows it fails
	 */
	public Optional<String> down() {
		try (final var adapter = connect()) {
			final var ledger = new Ledger(adapter, tableName);
			final var executed = ledger.list();
			if (executed.isEmpty()) {
				LOG.info("No migrations to rollback");
				return Optional.empty();
			}
			final var last = executed.get(executed.size() - 1);
			final var migration = unitSource.load(last);
			try {
				migration.down(adapter);
			} catch (RuntimeException exception) {
				throw new FailedToMigrateException(last, BACKWARD, exception);
			}
			try {
				ledger.remove(last);
			} catch (RuntimeException exception) {
				throw new FailedToMigrateException(last, BACKWARD, true, exception);
			}
			LOG.info("Rolled back {}", last);
			return Optional.of(last);
		}
	}

	public MigrationStatus status() {
		try (final var adapter = connect()) {
			final var executed = new Ledger(adapter, tableName).list();
			final var available = unitSource.getIdentifiers();
			return new MigrationStatus(executed, subtract(available, executed), subtract(executed, available));
		}
	}

	/**
	 * Scaffolds a new SQL migration in the migrations directory.
	 *
	 * @throws IllegalStateException if this migrator does not read its migrations from a directory
	 */
	public Path create(String name) {
		if (unitSource instanceof final DirectoryUnitSource directoryUnitSource) {
			return new Scaffolder(directoryUnitSource.getDirectory()).create(name);
		}
		throw new IllegalStateException("Only migrations read from a directory can be scaffolded!");
	}

	private void migrateForward(Adapter adapter, Ledger ledger, String identifier) {
		final var migration = unitSource.load(identifier);
		try {
			migration.up(adapter);
		} catch (RuntimeException exception) {
			throw new FailedToMigrateException(identifier, FORWARD, exception);
		}
		try {
			ledger.record(identifier);
		} catch (DuplicateEntryException exception) {
			throw new FailedToMigrateException(identifier, FORWARD, exception);
		} catch (RuntimeException exception) {
			throw new FailedToMigrateException(identifier, FORWARD, true, exception);
		}
		LOG.info("Migrated {}", identifier);
	}

	private Adapter connect() {
		final var adapter = adapterFactory.get();
		try {
			adapter.connect();
		} catch (RuntimeException exception) {
			adapter.close();
			throw exception;
		}
		return adapter;
	}

}
