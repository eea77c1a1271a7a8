package mongomigrator.fixtures.ordered.migrations;

import mongomigrator.Migration;
import mongomigrator.annotations.ChangeUnit;

@ChangeUnit("0009_abstract")
public abstract class AbstractFixtureMigration implements Migration {
}
