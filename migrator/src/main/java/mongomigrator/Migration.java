package mongomigrator;

import com.mongodb.client.MongoDatabase;

/**
 * A single reversible schema or data change.
 *
 * <p>Implement this interface once per change and annotate the class with
 * {@link mongomigrator.annotations.ChangeUnit}. The migration manager calls
 * {@link #apply(MongoDatabase)} at most once per ledger state and
 * {@link #revert(MongoDatabase)} on rollback.
 *
 * <h2>Example:</h2>
 * <pre>
 * {@literal @}ChangeUnit("0001_create_text_index")
 * public class CreateTextIndex implements Migration {
 *     {@literal @}Override
 *     public void apply(MongoDatabase db) {
 *         db.getCollection("articles").createIndex(Indexes.compoundIndex(
 *                 Indexes.text("title"), Indexes.text("body")));
 *     }
 *
 *     {@literal @}Override
 *     public void revert(MongoDatabase db) {
 *         db.getCollection("articles").dropIndex("title_text_body_text");
 *     }
 * }
 * </pre>
 *
 * <p>The database handle belongs to the manager; implementations must not
 * close it. Failures must be thrown, never swallowed: the ledger is only
 * updated after a method returns normally.
 *
 * @see mongomigrator.annotations.ChangeUnit
 * @see mongomigrator.engine.MigrationManager
 */
public interface Migration {

    /**
     * Performs the forward change.
     *
     * @param db the database to migrate (never null)
     * @throws Exception if the change fails
     */
    void apply(MongoDatabase db) throws Exception;

    /**
     * Performs the exact inverse of {@link #apply(MongoDatabase)}.
     *
     * @param db the database to migrate (never null)
     * @throws Exception if the change cannot be reverted
     */
    void revert(MongoDatabase db) throws Exception;
}
