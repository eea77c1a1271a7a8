package mongomigrator.fixtures.gap.migrations;

import com.mongodb.client.MongoDatabase;
import mongomigrator.Migration;
import mongomigrator.annotations.ChangeUnit;
import mongomigrator.fixtures.FixtureCalls;

@ChangeUnit("0003_third")
public class GapThird implements Migration {

    @Override
    public void apply(MongoDatabase db) {
        FixtureCalls.record("apply:GapThird");
    }

    @Override
    public void revert(MongoDatabase db) {
        FixtureCalls.record("revert:GapThird");
    }
}
