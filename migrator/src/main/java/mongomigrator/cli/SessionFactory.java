package mongomigrator.cli;

import mongomigrator.config.MigrationConfig;

/**
 * Opens the {@link MigrationSession} a command runs in.
 */
@FunctionalInterface
public interface SessionFactory {

    SessionFactory MONGO = MigrationSession::open;

    MigrationSession open(MigrationConfig config);
}
