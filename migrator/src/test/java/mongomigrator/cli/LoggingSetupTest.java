package mongomigrator.cli;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LoggingSetupTest {

    @Test
    void libraryShipsNoLogbackConfiguration() {
        ClassLoader cl = MigratorCli.class.getClassLoader();

        assertNull(cl.getResource("logback.xml"));
        assertNotNull(cl.getResource("logback-test.xml"));
    }
}
