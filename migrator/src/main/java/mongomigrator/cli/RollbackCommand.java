package mongomigrator.cli;

import mongomigrator.exceptions.MigrateException;
import mongomigrator.plan.MigrationDescriptor;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(
        name = "rollback",
        mixinStandardHelpOptions = true,
        description = "Roll back one migration, resolved in <module>.migrations or in migrations."
)
class RollbackCommand extends SessionCommand {

    @CommandLine.Parameters(index = "0..1", arity = "1..2", paramLabel = "[<module>] <migration>",
            description = "Optional module, then the migration id or class name")
    List<String> args;

    @Override
    void run(MigrationSession session) throws MigrateException {
        String location = session.config().locationOf(moduleOf(args));
        MigrationDescriptor migration = session.loader().load(location, migrationOf(args));

        session.manager().rollback(migration);
        spec.commandLine().getOut().printf("%s rolled back%n", migration.id());
    }
}
