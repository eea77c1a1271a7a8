package mongomigrator.alert;

import mongomigrator.plan.MigrationDescriptor;
import org.slf4j.Logger;

import java.util.Objects;

/**
 * Structured logging for migration events.
 *
 * <p>Log entries start with a marker such as MIGRATION_APPLIED or
 * ROLLBACK_FAILED followed by key=value pairs, which keeps them easy to grep
 * and to parse in log aggregators.
 *
 * <h2>Log Levels:</h2>
 * <ul>
 *   <li>INFO: run boundaries, applied and rolled back migrations</li>
 *   <li>DEBUG: migrations skipped because they are already applied</li>
 *   <li>WARN: rollback of a migration that has no ledger record</li>
 *   <li>ERROR: failures</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  migration - RUN_STARTED migrations=3
 * 12:00:00.100 INFO  migration - MIGRATION_STARTED name=CreateTextIndex order=1
 * 12:00:00.400 INFO  migration - MIGRATION_APPLIED name=CreateTextIndex order=1 duration_ms=300
 * 12:00:00.500 INFO  migration - RUN_COMPLETED applied=3 skipped=0 duration_ms=500
 * </pre>
 */
public final class MigrationEventLogger {

    private final Logger log;

    /**
     * @param log the logger events are written to
     */
    public MigrationEventLogger(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    public void runStarted(int migrationCount) {
        log.info("RUN_STARTED migrations={}", migrationCount);
    }

    public void runCompleted(int applied, int skipped, long durationMs) {
        log.info("RUN_COMPLETED applied={} skipped={} duration_ms={}", applied, skipped, durationMs);
    }

    public void runFailed(Throwable error, long durationMs) {
        log.error("RUN_FAILED duration_ms={} error={}", durationMs, error.getMessage());
    }

    public void migrationStarted(MigrationDescriptor d) {
        log.info("MIGRATION_STARTED name={} order={}", d.name(), d.order());
    }

    public void migrationApplied(MigrationDescriptor d, long durationMs) {
        log.info("MIGRATION_APPLIED name={} order={} duration_ms={}", d.name(), d.order(), durationMs);
    }

    public void migrationSkipped(MigrationDescriptor d) {
        log.debug("MIGRATION_SKIPPED name={} order={} reason=already_applied", d.name(), d.order());
    }

    public void migrationFailed(MigrationDescriptor d, Throwable error) {
        log.error("MIGRATION_FAILED name={} order={} error={}", d.name(), d.order(), error.getMessage(), error);
    }

    public void rollbackStarted(MigrationDescriptor d) {
        log.info("ROLLBACK_STARTED name={} order={}", d.name(), d.order());
    }

    public void rollbackCompleted(MigrationDescriptor d, boolean recordDeleted, long durationMs) {
        if (recordDeleted) {
            log.info("ROLLBACK_COMPLETED name={} order={} duration_ms={}", d.name(), d.order(), durationMs);
        } else {
            log.warn("ROLLBACK_COMPLETED name={} order={} duration_ms={} ledger_record=absent",
                    d.name(), d.order(), durationMs);
        }
    }

    public void rollbackFailed(MigrationDescriptor d, Throwable error) {
        log.error("ROLLBACK_FAILED name={} order={} error={}", d.name(), d.order(), error.getMessage(), error);
    }
}
