package mongomigrator.cli;

import mongomigrator.exceptions.MigrateException;
import mongomigrator.plan.MigrationSet;
import picocli.CommandLine;

@CommandLine.Command(
        name = "migrate",
        mixinStandardHelpOptions = true,
        description = "Apply all pending migrations of <module>.migrations in order."
)
class MigrateCommand extends SessionCommand {

    @CommandLine.Parameters(index = "0", paramLabel = "<module>",
            description = "Package containing the migrations package, e.g. backend")
    String module;

    @Override
    void run(MigrationSession session) throws MigrateException {
        MigrationSet set = session.discovery().discover(session.config().locationOf(module));
        int applied = session.manager().applyAll(set);
        spec.commandLine().getOut().printf("Applied %d of %d migrations%n", applied, set.size());
    }
}
