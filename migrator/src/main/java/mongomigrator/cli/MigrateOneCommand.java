package mongomigrator.cli;

import mongomigrator.exceptions.MigrateException;
import mongomigrator.plan.MigrationDescriptor;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(
        name = "migrate-one",
        mixinStandardHelpOptions = true,
        description = "Apply one migration, resolved in <module>.migrations or in migrations."
)
class MigrateOneCommand extends SessionCommand {

    @CommandLine.Parameters(index = "0..1", arity = "1..2", paramLabel = "[<module>] <migration>",
            description = "Optional module, then the migration id or class name")
    List<String> args;

    @Override
    void run(MigrationSession session) throws MigrateException {
        String location = session.config().locationOf(moduleOf(args));
        MigrationDescriptor migration = session.loader().load(location, migrationOf(args));

        boolean applied = session.manager().applyOne(migration);
        spec.commandLine().getOut().printf("%s %s%n",
                migration.id(), applied ? "applied" : "already applied");
    }
}
