package mongomigrator.cli;

import mongomigrator.exceptions.MigrateException;
import mongomigrator.plan.MigrationSet;
import mongomigrator.state.MigrationStatus;
import picocli.CommandLine;

import java.io.PrintWriter;

@CommandLine.Command(
        name = "status",
        mixinStandardHelpOptions = true,
        description = "List the migrations of <module>.migrations and whether they are applied."
)
class StatusCommand extends SessionCommand {

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "<module>",
            description = "Package containing the migrations package; omit for ./migrations")
    String module;

    @Override
    void run(MigrationSession session) throws MigrateException {
        MigrationSet set = session.discovery().discover(session.config().locationOf(module));

        PrintWriter out = spec.commandLine().getOut();
        for (MigrationStatus status : session.manager().status(set)) {
            out.printf("%-8s %s (%s)%n",
                    status.applied() ? "applied" : "pending", status.id(), status.name());
        }
        out.flush();
    }
}
