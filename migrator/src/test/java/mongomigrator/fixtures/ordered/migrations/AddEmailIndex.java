package mongomigrator.fixtures.ordered.migrations;

import com.mongodb.client.MongoDatabase;
import mongomigrator.Migration;
import mongomigrator.annotations.ChangeUnit;
import mongomigrator.fixtures.FixtureCalls;

@ChangeUnit("0002_add_email_index")
public class AddEmailIndex implements Migration {

    @Override
    public void apply(MongoDatabase db) {
        FixtureCalls.record("apply:AddEmailIndex");
    }

    @Override
    public void revert(MongoDatabase db) {
        FixtureCalls.record("revert:AddEmailIndex");
    }
}
