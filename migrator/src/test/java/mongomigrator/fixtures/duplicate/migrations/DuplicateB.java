package mongomigrator.fixtures.duplicate.migrations;

import com.mongodb.client.MongoDatabase;
import mongomigrator.Migration;
import mongomigrator.annotations.ChangeUnit;
import mongomigrator.fixtures.FixtureCalls;

@ChangeUnit("0001_b")
public class DuplicateB implements Migration {

    @Override
    public void apply(MongoDatabase db) {
        FixtureCalls.record("apply:DuplicateB");
    }

    @Override
    public void revert(MongoDatabase db) {
        FixtureCalls.record("revert:DuplicateB");
    }
}
