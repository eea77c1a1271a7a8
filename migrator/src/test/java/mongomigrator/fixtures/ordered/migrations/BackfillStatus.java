package mongomigrator.fixtures.ordered.migrations;

import com.mongodb.client.MongoDatabase;
import mongomigrator.Migration;
import mongomigrator.annotations.ChangeUnit;
import mongomigrator.fixtures.FixtureCalls;

@ChangeUnit("0003_backfill_status")
public class BackfillStatus implements Migration {

    @Override
    public void apply(MongoDatabase db) {
        FixtureCalls.record("apply:BackfillStatus");
    }

    @Override
    public void revert(MongoDatabase db) {
        FixtureCalls.record("revert:BackfillStatus");
    }
}
