package mongomigrator.cli;

import com.mongodb.MongoException;
import mongomigrator.config.MigrationConfig;
import mongomigrator.config.MigrationConfigException;
import mongomigrator.exceptions.MigrateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Base of the subcommands: loads the settings, opens a session, runs, and
 * maps every failure to exit code 1 after logging it.
 */
abstract class SessionCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SessionCommand.class);

    static final int FAILED = 1;

    @CommandLine.ParentCommand
    MigratorCli parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        try {
            MigrationConfig config = parent.loadConfig();
            try (MigrationSession session = parent.sessionFactory().open(config)) {
                run(session);
            }
            return CommandLine.ExitCode.OK;
        } catch (MigrateException e) {
            log.error("{} failed: {}", spec.name(), e.getMessage(), e);
        } catch (MigrationConfigException e) {
            log.error("Invalid settings: {}", e.getMessage());
        } catch (MongoException | IllegalArgumentException e) {
            log.error("{} failed: {}", spec.name(), e.getMessage(), e);
        }
        return FAILED;
    }

    abstract void run(MigrationSession session) throws MigrateException;

    /**
     * Splits {@code [<module>] <migration>} positionals.
     *
     * @return the module, or null when only the migration is given
     */
    static String moduleOf(List<String> args) {
        return args.size() > 1 ? args.get(0) : null;
    }

    static String migrationOf(List<String> args) {
        return args.get(args.size() - 1);
    }
}
