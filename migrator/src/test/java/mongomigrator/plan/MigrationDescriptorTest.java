package mongomigrator.plan;

import com.mongodb.client.MongoDatabase;
import mongomigrator.Migration;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MigrationDescriptorTest {

    private static final Migration NOOP = new Migration() {
        @Override
        public void apply(MongoDatabase db) {
        }

        @Override
        public void revert(MongoDatabase db) {
        }
    };

    @Test
    void orderIsParsedFromPrefix() {
        MigrationDescriptor d = new MigrationDescriptor("0002_add_field", "AddField", NOOP);

        assertEquals(2, d.order());
        assertEquals("0002_add_field", d.id());
        assertEquals("AddField", d.name());
        assertSame(NOOP, d.migration());
    }

    @Test
    void orderStopsAtFirstUnderscore() {
        assertEquals(10, MigrationDescriptor.orderOf("10_split_name_fields"));
    }

    @Test
    void malformedIdsAreRejected() {
        assertFalse(MigrationDescriptor.isValidId("add_field"));
        assertFalse(MigrationDescriptor.isValidId("0002"));
        assertFalse(MigrationDescriptor.isValidId("0002_"));
        assertFalse(MigrationDescriptor.isValidId(null));
        assertThrows(IllegalArgumentException.class,
                () -> new MigrationDescriptor("create-index", "CreateIndex", NOOP));
    }

    @Test
    void hugeOrderIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> MigrationDescriptor.orderOf("99999999999_too_big"));
    }

    @Test
    void toStringShowsIdentity() {
        String s = new MigrationDescriptor("0001_init", "Init", NOOP).toString();

        assertTrue(s.contains("id=0001_init"));
        assertTrue(s.contains("order=1"));
    }
}
