package mongomigrator.engine;

import com.mongodb.client.MongoDatabase;
import mongomigrator.alert.MigrationEventLogger;
import mongomigrator.exceptions.MigrateException;
import mongomigrator.exceptions.MigrateException.Stage;
import mongomigrator.exceptions.OperationException;
import mongomigrator.exceptions.PrerequisiteException;
import mongomigrator.ledger.LedgerRecord;
import mongomigrator.ledger.MigrationLedger;
import mongomigrator.lock.MigrationLock;
import mongomigrator.lock.NoopMigrationLock;
import mongomigrator.plan.MigrationDescriptor;
import mongomigrator.plan.MigrationSet;
import mongomigrator.state.MigrationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies and rolls back migrations, keeping the ledger in step.
 *
 * <ul>
 *   <li>{@link #applyAll(MigrationSet)} applies a set in ascending order and stops at the first failure</li>
 *   <li>{@link #applyOne(MigrationDescriptor)} applies one migration once its predecessor is in the ledger</li>
 *   <li>{@link #rollback(MigrationDescriptor)} reverts one migration and removes its ledger record</li>
 * </ul>
 *
 * <p>The ledger is written only after {@code apply} or {@code revert} returns
 * normally, so a record exists if and only if the migration's last successful
 * operation was {@code apply}. Every operation runs sequentially on the
 * caller's thread, inside the configured {@link MigrationLock}.
 *
 * <p>There is no retry and no timeout: a failure ends the run and a hung
 * database call hangs it.
 */
public final class MigrationManager {

    private final MongoDatabase db;
    private final MigrationLedger ledger;
    private final MigrationLock lock;
    private final MigrationEventLogger events;

    public MigrationManager(MongoDatabase db, MigrationLedger ledger) {
        this(db, ledger, NoopMigrationLock.INSTANCE, LoggerFactory.getLogger("migration"));
    }

    /**
     * @param db the database handed to every migration, owned by the caller
     * @param ledger the ledger of applied migrations
     * @param lock the lock held during each operation, or null for none
     * @param log the logger receiving migration events
     */
    public MigrationManager(MongoDatabase db, MigrationLedger ledger, MigrationLock lock, Logger log) {
        this.db = Objects.requireNonNull(db, "db");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.lock = lock != null ? lock : NoopMigrationLock.INSTANCE;
        this.events = new MigrationEventLogger(log);
    }

    /**
     * Applies every migration of the set that is not applied yet, in order.
     *
     * @param set the migrations to apply
     * @return the number of migrations applied by this call
     * @throws MigrateException on the first failure; later migrations are not attempted
     */
    public int applyAll(MigrationSet set) throws MigrateException {
        Objects.requireNonNull(set, "set");

        long start = System.currentTimeMillis();
        int applied = 0;
        int skipped = 0;

        lock.acquire();
        try {
            events.runStarted(set.size());
            for (MigrationDescriptor d : set.ordered()) {
                if (doApply(d)) {
                    applied++;
                } else {
                    skipped++;
                }
            }
            events.runCompleted(applied, skipped, System.currentTimeMillis() - start);
            return applied;
        } catch (MigrateException e) {
            events.runFailed(e, System.currentTimeMillis() - start);
            throw e;
        } finally {
            lock.release();
        }
    }

    /**
     * Applies a single migration.
     *
     * @param migration the migration to apply
     * @return true if it was applied, false if the ledger already had it
     * @throws PrerequisiteException if the migration with the previous order is not applied
     * @throws OperationException if {@code apply} fails; the ledger is left unchanged
     * @throws MigrateException if the ledger or lock cannot be used
     */
    public boolean applyOne(MigrationDescriptor migration) throws MigrateException {
        Objects.requireNonNull(migration, "migration");

        lock.acquire();
        try {
            return doApply(migration);
        } finally {
            lock.release();
        }
    }

    /**
     * Reverts a single migration and deletes its ledger record.
     *
     * <p>Ordering is not checked and {@code revert} is called even when the
     * ledger has no record for the migration.
     *
     * @param migration the migration to roll back
     * @return true if a ledger record was deleted
     * @throws OperationException if {@code revert} fails; the ledger record is kept
     * @throws MigrateException if the ledger or lock cannot be used
     */
    public boolean rollback(MigrationDescriptor migration) throws MigrateException {
        Objects.requireNonNull(migration, "migration");

        lock.acquire();
        try {
            return doRollback(migration);
        } finally {
            lock.release();
        }
    }

    /**
     * Reports which migrations of a set have a ledger record.
     *
     * @param set the migrations to report on
     * @return one status per migration, in order
     * @throws MigrateException if the ledger or lock cannot be used
     */
    public List<MigrationStatus> status(MigrationSet set) throws MigrateException {
        Objects.requireNonNull(set, "set");

        lock.acquire();
        try {
            List<MigrationStatus> result = new ArrayList<>(set.size());
            for (MigrationDescriptor d : set.ordered()) {
                result.add(MigrationStatus.of(d, ledger.findByName(d.name()).isPresent()));
            }
            return result;
        } finally {
            lock.release();
        }
    }

    /* ---------------- private helper methods ---------------- */

    private boolean doApply(MigrationDescriptor d) throws MigrateException {
        checkPrerequisite(d);

        if (ledger.findByName(d.name()).isPresent()) {
            events.migrationSkipped(d);
            return false;
        }

        events.migrationStarted(d);
        long start = System.currentTimeMillis();
        try {
            d.migration().apply(db);
        } catch (Exception e) {
            restoreInterrupt(e);
            events.migrationFailed(d, e);
            throw new OperationException(d.name(), Stage.APPLY, e);
        }

        ledger.insert(LedgerRecord.applied(d.name(), d.order()));
        events.migrationApplied(d, System.currentTimeMillis() - start);
        return true;
    }

    private void checkPrerequisite(MigrationDescriptor d) throws MigrateException {
        if (d.order() <= 1) return;

        int previous = d.order() - 1;
        if (ledger.findByOrder(previous).isEmpty()) {
            PrerequisiteException e = new PrerequisiteException(d.name(), previous);
            events.migrationFailed(d, e);
            throw e;
        }
    }

    private boolean doRollback(MigrationDescriptor d) throws MigrateException {
        events.rollbackStarted(d);
        long start = System.currentTimeMillis();
        try {
            d.migration().revert(db);
        } catch (Exception e) {
            restoreInterrupt(e);
            events.rollbackFailed(d, e);
            throw new OperationException(d.name(), Stage.REVERT, e);
        }

        boolean deleted = ledger.deleteByName(d.name());
        events.rollbackCompleted(d, deleted, System.currentTimeMillis() - start);
        return deleted;
    }

    private static void restoreInterrupt(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }
}
