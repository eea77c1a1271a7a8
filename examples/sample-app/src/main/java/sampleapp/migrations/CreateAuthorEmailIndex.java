package sampleapp.migrations;

import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import mongomigrator.Migration;
import mongomigrator.annotations.ChangeUnit;

@ChangeUnit("0003_create_author_email_index")
public class CreateAuthorEmailIndex implements Migration {

    static final String COLLECTION = "authors";
    static final String INDEX_NAME = "email_unique";

    @Override
    public void apply(MongoDatabase db) {
        db.getCollection(COLLECTION).createIndex(
                Indexes.ascending("email"),
                new IndexOptions().name(INDEX_NAME).unique(true));
    }

    @Override
    public void revert(MongoDatabase db) {
        db.getCollection(COLLECTION).dropIndex(INDEX_NAME);
    }
}
