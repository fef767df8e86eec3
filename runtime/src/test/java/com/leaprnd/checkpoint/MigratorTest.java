package com.leaprnd.checkpoint;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.ThrowingSupplier;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.TreeSet;

import static com.leaprnd.checkpoint.ExecutionDirection.BACKWARD;
import static com.leaprnd.checkpoint.ExecutionDirection.FORWARD;
import static java.util.Collections.shuffle;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MigratorTest {

	private static final String TABLE = "schema_migrations";

	private static final String A = "20250101000000_a";
	private static final String B = "20250102000000_b";
	private static final String C = "20250103000000_c";

	private InMemoryAdapter adapter;
	private RegisteredUnitSource units;
	private Migrator migrator;

	@BeforeEach
	public void setUp() {
		adapter = new InMemoryAdapter();
		units = new RegisteredUnitSource();
		migrator = new Migrator(() -> adapter, units, TABLE);
	}

	private void register(String ... identifiers) {
		for (final var identifier : identifiers) {
			units.register(identifier, new RecordingMigration(identifier));
		}
	}

	@Test
	public void testFreshProject() {
		register(A, B);
		migrator.init();
		final var before = migrator.status();
		assertEquals(List.of(), before.executed());
		assertEquals(List.of(A, B), before.pending());
		assertEquals(List.of(A, B), migrator.up());
		assertEquals(List.of(A, B), adapter.getLedger(TABLE));
		assertEquals(List.of("CREATE " + A, "CREATE " + B), adapter.getStatements());
		final var after = migrator.status();
		assertEquals(List.of(A, B), after.executed());
		assertEquals(List.of(), after.pending());
		assertTrue(after.isUpToDate());
	}

	@Test
	public void testUpCreatesLedgerTableWhenMissing() {
		register(A);
		assertEquals(List.of(A), migrator.up());
		assertEquals(List.of(A), adapter.getLedger(TABLE));
	}

	@Test
	public void testUpIsIdempotent() {
		register(A, B);
		migrator.up();
		final var statements = List.copyOf(adapter.getStatements());
		assertEquals(List.of(), assertDoesNotThrow((ThrowingSupplier<List<String>>) migrator::up));
		assertEquals(statements, adapter.getStatements());
		assertEquals(List.of(A, B), adapter.getLedger(TABLE));
	}

	@Test
	public void testUpAppliesOnlyPendingMigrations() {
		adapter.withLedger(TABLE, A);
		register(C, A, B);
		assertEquals(List.of(B, C), migrator.up());
		assertEquals(List.of("CREATE " + B, "CREATE " + C), adapter.getStatements());
		assertEquals(List.of(A, B, C), adapter.getLedger(TABLE));
	}

	@Test
	public void testUpAppliesInIdentifierOrderRegardlessOfLedgerOrder() {
		adapter.withLedger(TABLE, C);
		register(A, B, C);
		assertEquals(List.of(A, B), migrator.up());
		assertEquals(List.of(C, A, B), adapter.getLedger(TABLE));
	}

	@Test
	public void testUpStopsAtFirstFailure() {
		register(A, B, C);
		adapter.failOn("CREATE " + B);
		final var exception = assertThrows(FailedToMigrateException.class, migrator::up);
		assertEquals(B, exception.getIdentifier());
		assertEquals(FORWARD, exception.getDirection());
		assertFalse(exception.isLedgerInconsistent());
		assertInstanceOf(ExecutionFailedException.class, exception.getCause());
		assertTrue(exception.getMessage().contains(B));
		assertEquals(List.of(A), adapter.getLedger(TABLE));
		assertEquals(List.of("CREATE " + A), adapter.getStatements());
		assertFalse(adapter.isConnected());
	}

	@Test
	public void testUpReportsEachAppliedMigrationBeforeAFailure() {
		register(A, B, C);
		adapter.failOn("CREATE " + C);
		final var reported = new ArrayList<String>();
		assertThrows(FailedToMigrateException.class, () -> migrator.up(reported::add));
		assertEquals(List.of(A, B), reported);
		assertEquals(List.of(A, B), adapter.getLedger(TABLE));
	}

	@Test
	public void testUpWrapsExceptionsThrownByMigrations() {
		register(A);
		units.register(B, Migration.of(
			adapter -> {
				throw new IllegalStateException("boom");
			},
			adapter -> {}
		));
		final var exception = assertThrows(FailedToMigrateException.class, migrator::up);
		assertEquals(B, exception.getIdentifier());
		assertInstanceOf(IllegalStateException.class, exception.getCause());
		assertEquals(List.of(A), adapter.getLedger(TABLE));
	}

	@Test
	public void testUpReportsMigrationThatRanButWasNotRecorded() {
		register(A);
		adapter.withLedger(TABLE).failLedgerWrites();
		final var exception = assertThrows(FailedToMigrateException.class, migrator::up);
		assertEquals(A, exception.getIdentifier());
		assertTrue(exception.isLedgerInconsistent());
		assertTrue(exception.getMessage().contains("not recorded"));
		assertEquals(List.of("CREATE " + A), adapter.getStatements());
		assertEquals(List.of(), adapter.getLedger(TABLE));
	}

	@Test
	public void testUpFailsWhenAnotherMigratorRecordedTheSameMigration() {
		units.register(A, Migration.of(
			adapter -> adapter.insertLedgerEntry(TABLE, A),
			adapter -> {}
		));
		final var exception = assertThrows(FailedToMigrateException.class, migrator::up);
		assertFalse(exception.isLedgerInconsistent());
		assertTrue(exception.isRecordedConcurrently());
		assertInstanceOf(DuplicateEntryException.class, exception.getCause());
		assertEquals(
			A + " ran up successfully but another process recorded it in " + TABLE + " first; its statements may have run twice",
			exception.getMessage()
		);
		assertEquals(List.of(A), adapter.getLedger(TABLE));
	}

	@Test
	public void testDownRollsBackMostRecentlyApplied() {
		register(A, B, C);
		migrator.up();
		assertEquals(Optional.of(C), migrator.down());
		assertEquals(List.of(A, B), adapter.getLedger(TABLE));
		assertEquals("DROP " + C, adapter.getStatements().get(adapter.getStatements().size() - 1));
		assertEquals(List.of(C), migrator.status().pending());
	}

	@Test
	public void testDownFollowsLedgerOrderRatherThanIdentifierOrder() {
		adapter.withLedger(TABLE, B, A);
		register(A, B);
		assertEquals(Optional.of(A), migrator.down());
		assertEquals(List.of(B), adapter.getLedger(TABLE));
	}

	@Test
	public void testRepeatedDownRollsBackOneAtATime() {
		register(A, B);
		migrator.up();
		assertEquals(Optional.of(B), migrator.down());
		assertEquals(Optional.of(A), migrator.down());
		assertEquals(Optional.empty(), migrator.down());
		assertEquals(List.of(), adapter.getLedger(TABLE));
	}

	@Test
	public void testDownWithNothingApplied() {
		register(A);
		adapter.withLedger(TABLE);
		assertEquals(Optional.empty(), migrator.down());
		assertEquals(List.of(), adapter.getStatements());
	}

	@Test
	public void testDownFailsWhenMigrationIsMissing() {
		adapter.withLedger(TABLE, A, B);
		register(A);
		final var exception = assertThrows(UnitNotFoundException.class, migrator::down);
		assertEquals(B, exception.getIdentifier());
		assertEquals(List.of(A, B), adapter.getLedger(TABLE));
		assertFalse(adapter.isConnected());
	}

	@Test
	public void testDownFailureKeepsLedgerEntry() {
		register(A, B);
		migrator.up();
		adapter.failOn("DROP " + B);
		final var exception = assertThrows(FailedToMigrateException.class, migrator::down);
		assertEquals(B, exception.getIdentifier());
		assertEquals(BACKWARD, exception.getDirection());
		assertFalse(exception.isLedgerInconsistent());
		assertEquals(List.of(A, B), adapter.getLedger(TABLE));
	}

	@Test
	public void testStatusReportsMissingMigrations() {
		adapter.withLedger(TABLE, A, B);
		register(A, C);
		final var status = migrator.status();
		assertEquals(List.of(A, B), status.executed());
		assertEquals(List.of(C), status.pending());
		assertEquals(List.of(B), status.missing());
		assertFalse(status.isConsistent());
	}

	@Test
	public void testStatusDoesNotWrite() {
		adapter.withLedger(TABLE, A);
		register(A, B);
		migrator.status();
		assertEquals(List.of(), adapter.getStatements());
		assertEquals(List.of(A), adapter.getLedger(TABLE));
	}

	@Test
	public void testEveryOperationOpensAndReleasesItsOwnAdapter() {
		register(A);
		migrator.init();
		migrator.status();
		migrator.up();
		migrator.down();
		assertEquals(4, adapter.getConnectionCount());
		assertFalse(adapter.isConnected());
	}

	@Test
	public void testConnectionFailureIsSurfacedVerbatim() {
		final var failing = new InMemoryAdapter() {
			@Override
			public void connect() {
				throw new ConnectionException("PostgreSQL", new SQLException("Connection refused"));
			}
		};
		final var exception = assertThrows(
			ConnectionException.class,
			() -> new Migrator(() -> failing, units, TABLE).up()
		);
		assertEquals("PostgreSQL connection failed: Connection refused", exception.getMessage());
	}

	@Test
	public void testTableNameIsValidated() {
		assertThrows(ConfigurationException.class, () -> new Migrator(() -> adapter, units, "bad-name"));
		assertThrows(ConfigurationException.class, () -> new Migrator(() -> adapter, units, "1table"));
		assertThrows(ConfigurationException.class, () -> new Migrator(() -> adapter, units, "x; DROP TABLE y"));
		assertDoesNotThrow(() -> new Migrator(() -> adapter, units, "valid_name"));
		assertDoesNotThrow(() -> new Migrator(() -> adapter, units, "_Valid2"));
	}

	@Test
	public void testSubtractPreservesOrderOfAvailable() {
		final var random = new Random(7478093087527115071L);
		for (var trial = 0; trial < 200; trial ++) {
			final var available = randomIdentifiers(random);
			final var executed = new ArrayList<String>();
			for (final var identifier : available) {
				if (random.nextBoolean()) {
					executed.add(identifier);
				}
			}
			final var pending = Migrator.subtract(available, executed);
			for (final var identifier : executed) {
				assertFalse(pending.contains(identifier));
			}
			final var expected = new ArrayList<>(available);
			expected.removeAll(executed);
			assertEquals(expected, pending);
		}
	}

	@Test
	public void testUpAlwaysAppliesInAscendingOrder() {
		final var random = new Random(936908912751334464L);
		for (var trial = 0; trial < 50; trial ++) {
			setUp();
			final var available = randomIdentifiers(random);
			final var shuffled = new ArrayList<>(available);
			shuffle(shuffled, random);
			final var executed = new ArrayList<String>();
			for (final var identifier : shuffled) {
				units.register(identifier, new RecordingMigration(identifier));
				if (random.nextInt(3) == 0) {
					executed.add(identifier);
				}
			}
			adapter.withLedger(TABLE, executed.toArray(String[]::new));
			final var applied = migrator.up();
			final var expected = new ArrayList<>(available);
			expected.removeAll(executed);
			assertEquals(expected, applied);
			for (var index = 1; index < applied.size(); index ++) {
				assertTrue(applied.get(index - 1).compareTo(applied.get(index)) < 0);
			}
		}
	}

	private static List<String> randomIdentifiers(Random random) {
		final var identifiers = new TreeSet<String>();
		final var count = random.nextInt(12);
		while (identifiers.size() < count) {
			identifiers.add(String.format("2025%010d_unit%d", random.nextInt(1_000_000_000), random.nextInt(100)));
		}
		return new ArrayList<>(identifiers);
	}

}
