package mongomigrator.scanner;

import mongomigrator.exceptions.DiscoveryException;
import mongomigrator.exceptions.LoadException;
import mongomigrator.exceptions.MigrateException;
import mongomigrator.load.MigrationLoader;
import mongomigrator.plan.MigrationDescriptor;
import mongomigrator.plan.MigrationSet;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MigrationDiscoveryTest {

    private final MigrationScanner scanner = new MigrationScanner();
    private final MigrationDiscovery discovery = new MigrationDiscovery(scanner, new MigrationLoader(scanner));

    @Test
    void discoversOrderedSet() throws MigrateException {
        MigrationSet set = discovery.discover("mongomigrator.fixtures.ordered.migrations");

        assertThat(set.ordered())
                .extracting(MigrationDescriptor::id)
                .containsExactly("0001_create_users", "0002_add_email_index", "0003_backfill_status");
        assertThat(set.ordered())
                .extracting(MigrationDescriptor::name)
                .containsExactly("CreateUsers", "AddEmailIndex", "BackfillStatus");
        assertThat(set.ordered())
                .extracting(MigrationDescriptor::order)
                .containsExactly(1, 2, 3);
    }

    @Test
    void rejectsGapInOrders() {
        assertThatThrownBy(() -> discovery.discover("mongomigrator.fixtures.gap.migrations"))
                .isInstanceOf(DiscoveryException.class)
                .hasMessageContaining("expected 2 but found 3");
    }

    @Test
    void rejectsDuplicateOrders() {
        assertThatThrownBy(() -> discovery.discover("mongomigrator.fixtures.duplicate.migrations"))
                .isInstanceOf(DiscoveryException.class)
                .hasMessageContaining("Duplicate migration order 1");
    }

    @Test
    void rejectsMalformedIds() {
        assertThatThrownBy(() -> discovery.discover("mongomigrator.fixtures.broken.migrations"))
                .isInstanceOf(DiscoveryException.class)
                .hasMessageContaining("Malformed migration id 'add-users'")
                .hasMessageContaining("stage=DISCOVERY");
    }

    @Test
    void rejectsChangeUnitsThatAreNotMigrations() {
        assertThatThrownBy(() -> discovery.discover("mongomigrator.fixtures.unloadable.migrations"))
                .isInstanceOf(LoadException.class)
                .hasMessageContaining("must implement Migration")
                .hasMessageContaining("migration=PlainTask");
    }

    @Test
    void rejectsMissingLocation() {
        assertThatThrownBy(() -> discovery.discover("nowhere.migrations"))
                .isInstanceOf(DiscoveryException.class)
                .hasMessageContaining("stage=DISCOVERY");
    }
}
