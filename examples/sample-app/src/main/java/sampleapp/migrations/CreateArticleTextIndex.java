package sampleapp.migrations;

import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import mongomigrator.Migration;
import mongomigrator.annotations.ChangeUnit;

/**
 * Full text index over article titles and bodies.
 */
@ChangeUnit("0001_create_article_text_index")
public class CreateArticleTextIndex implements Migration {

    static final String COLLECTION = "articles";
    static final String INDEX_NAME = "title_text_body_text";

    @Override
    public void apply(MongoDatabase db) {
        db.getCollection(COLLECTION).createIndex(
                Indexes.compoundIndex(Indexes.text("title"), Indexes.text("body")),
                new IndexOptions().name(INDEX_NAME));
    }

    @Override
    public void revert(MongoDatabase db) {
        db.getCollection(COLLECTION).dropIndex(INDEX_NAME);
    }
}
