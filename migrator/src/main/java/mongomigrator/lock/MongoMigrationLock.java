package mongomigrator.lock;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import mongomigrator.exceptions.MigrationLockException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Date;
import java.util.Objects;
import java.util.UUID;

/**
 * {@link MigrationLock} backed by a single document in a MongoDB collection.
 *
 * <p>Acquiring inserts {@code {_id: "migration-lock", owner, acquiredAt}}; the
 * unique {@code _id} makes a second insert fail with a duplicate key error while
 * the lock is held. Releasing deletes the document only if this instance owns it.
 *
 * <p>A runner that dies while holding the lock leaves the document behind; it
 * has to be deleted by hand.
 */
public class MongoMigrationLock implements MigrationLock {

    public static final String DEFAULT_COLLECTION = "migrations_lock";
    static final String LOCK_ID = "migration-lock";

    private static final Logger log = LoggerFactory.getLogger(MongoMigrationLock.class);

    private final MongoCollection<Document> collection;
    private final String owner;
    private boolean held;

    public MongoMigrationLock(MongoDatabase db, String collectionName) {
        this(db.getCollection(collectionName), UUID.randomUUID().toString());
    }

    public MongoMigrationLock(MongoCollection<Document> collection, String owner) {
        this.collection = Objects.requireNonNull(collection, "collection");
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    @Override
    public void acquire() throws MigrationLockException {
        if (held) return;

        Document lock = new Document("_id", LOCK_ID)
                .append("owner", owner)
                .append("acquiredAt", Date.from(Instant.now()));
        try {
            collection.insertOne(lock);
            held = true;
            log.debug("Migration lock acquired by {}", owner);
        } catch (MongoWriteException e) {
            if (e.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
                throw new MigrationLockException("Migration lock is held by another runner");
            }
            throw new MigrationLockException("Failed to acquire migration lock", e);
        } catch (MongoException e) {
            throw new MigrationLockException("Failed to acquire migration lock", e);
        }
    }

    @Override
    public void release() {
        if (!held) return;

        try {
            collection.deleteOne(Filters.and(
                    Filters.eq("_id", LOCK_ID),
                    Filters.eq("owner", owner)));
            log.debug("Migration lock released by {}", owner);
        } catch (MongoException e) {
            log.warn("Failed to release migration lock owned by {}", owner, e);
        } finally {
            held = false;
        }
    }

    /** Returns true while this instance holds the lock. */
    public boolean isHeld() {
        return held;
    }
}
