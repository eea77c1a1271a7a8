package mongomigrator.cli;

import mongomigrator.config.MigrationConfig;
import mongomigrator.config.MigrationConfigLoader;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Command line entry point of the migrator.
 *
 * <pre>
 * migrator migrate backend
 * migrator migrate-one backend 0002_add_status_field
 * migrator migrate-one 0001_create_text_index
 * migrator rollback backend AddStatusField
 * migrator status backend
 * </pre>
 */
@CommandLine.Command(
        name = "migrator",
        mixinStandardHelpOptions = true,
        version = "migrator 1.0",
        description = "Apply and roll back MongoDB migrations.",
        subcommands = {
                MigrateCommand.class,
                MigrateOneCommand.class,
                RollbackCommand.class,
                StatusCommand.class
        }
)
public class MigratorCli {

    @CommandLine.Option(
            names = {"-c", "--config"},
            description = "Settings file (.properties or .yml). Defaults to migrator.properties"
                    + " or migrator.yml in the working directory, then on the classpath.")
    Path configFile;

    private final SessionFactory sessionFactory;

    public MigratorCli() {
        this(SessionFactory.MONGO);
    }

    public MigratorCli(SessionFactory sessionFactory) {
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
    }

    MigrationConfig loadConfig() {
        return configFile != null
                ? MigrationConfigLoader.loadFromFile(configFile)
                : MigrationConfigLoader.load();
    }

    SessionFactory sessionFactory() {
        return sessionFactory;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MigratorCli()).execute(args);
        System.exit(exitCode);
    }
}
