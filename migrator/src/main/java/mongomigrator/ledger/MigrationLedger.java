package mongomigrator.ledger;

import mongomigrator.exceptions.LedgerException;

import java.util.List;
import java.util.Optional;

/**
 * Persistent record of applied migrations.
 *
 * <p>The ledger is the single source of truth for "has migration X been
 * applied" and "is the migration with order N applied". It does not enforce
 * uniqueness itself; callers check by name before inserting.
 *
 * @see MongoMigrationLedger
 */
public interface MigrationLedger {

    /**
     * Finds the record of a migration by name.
     *
     * @param name the migration name
     * @return the record, or empty if the migration is not applied
     * @throws LedgerException if the ledger cannot be read
     */
    Optional<LedgerRecord> findByName(String name) throws LedgerException;

    /**
     * Finds the record with the given order number.
     *
     * @param order the order number
     * @return the record, or empty if no applied migration has this order
     * @throws LedgerException if the ledger cannot be read
     */
    Optional<LedgerRecord> findByOrder(int order) throws LedgerException;

    /**
     * Stores a new record.
     *
     * @throws LedgerException if the record cannot be written
     */
    void insert(LedgerRecord record) throws LedgerException;

    /**
     * Deletes the record of a migration. Deleting an absent record is a no-op.
     *
     * @param name the migration name
     * @return true if a record was deleted
     * @throws LedgerException if the ledger cannot be written
     */
    boolean deleteByName(String name) throws LedgerException;

    /**
     * Lists all records, ascending by order.
     *
     * @throws LedgerException if the ledger cannot be read
     */
    List<LedgerRecord> findAll() throws LedgerException;
}
