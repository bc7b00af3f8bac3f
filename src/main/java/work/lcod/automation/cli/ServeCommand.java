package work.lcod.automation.cli;

import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.automation.loader.MacroLibrary;
import work.lcod.automation.rpc.RpcServer;
import work.lcod.automation.rpc.SessionCommands;
import work.lcod.automation.runtime.MacroExecutor;
import work.lcod.automation.session.SessionProviders;
import work.lcod.automation.shared.DurationParser;

@CommandLine.Command(
    name = "serve",
    description = "Expose the local automation backend and macro library to remote clients.",
    mixinStandardHelpOptions = true
)
final class ServeCommand implements Callable<Integer> {
    @CommandLine.Mixin
    private CommonOptions common;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--host", description = "Bind address.", defaultValue = CommandLine.Option.NULL_VALUE)
    private String host;

    @CommandLine.Option(names = "--port", description = "Listen port (0 picks a free one).", defaultValue = CommandLine.Option.NULL_VALUE)
    private Integer port;

    @CommandLine.Option(
        names = "--max-connections",
        description = "Concurrent client connections accepted.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer maxConnections;

    @CommandLine.Option(
        names = "--idle-timeout",
        description = "Shut down after no client has been connected this long (e.g. 5m; 0 disables).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String idleTimeoutRaw;

    @CommandLine.Option(
        names = "--backend",
        description = "Automation backend to serve when several are installed.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String backend;

    @Override
    public Integer call() throws Exception {
        var builder = common.settings();
        if (host != null) {
            builder.host(host);
        }
        if (port != null) {
            builder.port(port);
        }
        if (maxConnections != null) {
            builder.maxConnections(maxConnections);
        }
        var idle = DurationParser.parse(idleTimeoutRaw);
        if (idle.isPresent()) {
            builder.idleTimeout(idle.get().isZero() ? Optional.empty() : idle);
        }
        var settings = builder.build();
        settings.logLevel().apply();

        var session = SessionProviders.create(backend);
        var library = MacroLibrary.open(settings.macrosPath());
        var commands = new SessionCommands(session, library, new MacroExecutor(library, settings.limits()));

        try (var server = new RpcServer(commands.registry(), settings.maxConnections(), settings.idleTimeout())) {
            server.start(settings.host(), settings.port());
            var out = spec.commandLine().getOut();
            out.println("Serving " + library.list().size() + " macro(s) from " + library.root()
                + " on " + settings.host() + ":" + server.port());
            out.flush();
            server.awaitShutdown();
        }
        return 0;
    }
}
