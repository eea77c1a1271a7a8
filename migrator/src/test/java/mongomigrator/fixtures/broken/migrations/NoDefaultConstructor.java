package mongomigrator.fixtures.broken.migrations;

import com.mongodb.client.MongoDatabase;
import mongomigrator.Migration;
import mongomigrator.annotations.ChangeUnit;

@ChangeUnit("0002_no_default_constructor")
public class NoDefaultConstructor implements Migration {

    private final String collection;

    public NoDefaultConstructor(String collection) {
        this.collection = collection;
    }

    @Override
    public void apply(MongoDatabase db) {
        db.createCollection(collection);
    }

    @Override
    public void revert(MongoDatabase db) {
        db.getCollection(collection).drop();
    }
}
