package mongomigrator.fixtures.ordered.migrations.nested;

import com.mongodb.client.MongoDatabase;
import mongomigrator.Migration;
import mongomigrator.annotations.ChangeUnit;
import mongomigrator.fixtures.FixtureCalls;

@ChangeUnit("0004_nested")
public class NestedMigration implements Migration {

    @Override
    public void apply(MongoDatabase db) {
        FixtureCalls.record("apply:NestedMigration");
    }

    @Override
    public void revert(MongoDatabase db) {
        FixtureCalls.record("revert:NestedMigration");
    }
}
