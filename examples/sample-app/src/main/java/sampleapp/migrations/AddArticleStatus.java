package sampleapp.migrations;

import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Updates;
import mongomigrator.Migration;
import mongomigrator.annotations.ChangeUnit;

/**
 * Backfills {@code status: "published"} on articles created before drafts existed.
 *
 * <p>Reverting unsets only {@code status: "published"}. It cannot tell backfilled
 * values from ones the application wrote later, so those are lost as well.
 */
@ChangeUnit("0002_add_article_status")
public class AddArticleStatus implements Migration {

    static final String FIELD = "status";
    static final String PUBLISHED = "published";

    @Override
    public void apply(MongoDatabase db) {
        db.getCollection(CreateArticleTextIndex.COLLECTION).updateMany(
                Filters.exists(FIELD, false),
                Updates.set(FIELD, PUBLISHED));
    }

    @Override
    public void revert(MongoDatabase db) {
        db.getCollection(CreateArticleTextIndex.COLLECTION).updateMany(
                Filters.eq(FIELD, PUBLISHED),
                Updates.unset(FIELD));
    }
}
