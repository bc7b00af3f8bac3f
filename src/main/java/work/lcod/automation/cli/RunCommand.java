package work.lcod.automation.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Consumer;
import picocli.CommandLine;
import work.lcod.automation.api.AutomationSettings;
import work.lcod.automation.loader.MacroLibrary;
import work.lcod.automation.model.MacroResult;
import work.lcod.automation.rpc.RemoteSession;
import work.lcod.automation.rpc.RpcClient;
import work.lcod.automation.runtime.CancellationToken;
import work.lcod.automation.runtime.MacroExecutor;
import work.lcod.automation.session.AutomationSession;
import work.lcod.automation.session.SessionProviders;
import work.lcod.automation.shared.DurationParser;

@CommandLine.Command(
    name = "run",
    description = "Run a macro by name, or a macro document given as a .yaml/.yml file.",
    mixinStandardHelpOptions = true
)
final class RunCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Mixin
    private CommonOptions common;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "MACRO", description = "Macro name or path to a macro document.")
    private String target;

    @CommandLine.Option(
        names = {"-p", "--param"},
        paramLabel = "KEY=VALUE",
        description = "Macro parameter; repeat for several."
    )
    private Map<String, String> parameters = new LinkedHashMap<>();

    @CommandLine.Option(
        names = "--connect",
        paramLabel = "HOST[:PORT]",
        description = "Drive the automation backend of a running server.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String connect;

    @CommandLine.Option(
        names = "--on-server",
        description = "With --connect, let the server run the whole macro from its own library."
    )
    private boolean onServer;

    @CommandLine.Option(
        names = "--backend",
        description = "Local automation backend to use when several are installed.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String backend;

    @CommandLine.Option(
        names = "--timeout",
        description = "Default macro timeout (e.g. 30s, 2m) for macros that do not declare one.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(names = "--json", description = "Print the execution result as JSON.")
    private boolean json;

    @Override
    public Integer call() throws Exception {
        var builder = common.settings();
        DurationParser.parse(timeoutRaw).ifPresent(builder::macroTimeout);
        var settings = builder.build();
        settings.logLevel().apply();
        if (onServer && connect == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--on-server requires --connect");
        }

        var out = spec.commandLine().getOut();
        Consumer<String> sink = line -> {
            if (!json) {
                out.println(line);
                out.flush();
            }
        };
        var document = documentPath();

        MacroResult result;
        if (connect != null) {
            var endpoint = Endpoint.parse(connect, settings.port());
            try (var client = RpcClient.connect(endpoint.host(), endpoint.port(), ListCommand.CONNECT_TIMEOUT)) {
                var remote = new RemoteSession(client, settings.limits().macroTimeout());
                if (onServer) {
                    result = document != null
                        ? remote.runMacroYaml(read(document), parameters, sink)
                        : remote.runMacro(target, parameters, sink);
                } else {
                    result = runLocally(settings, remote, document, sink);
                }
            }
        } else {
            result = runLocally(settings, SessionProviders.create(backend), document, sink);
        }

        report(result, out);
        return result.success() ? 0 : 1;
    }

    private MacroResult runLocally(AutomationSettings settings, AutomationSession session, Path document, Consumer<String> sink)
        throws IOException {
        var cancellation = new CancellationToken();
        var hook = new Thread(cancellation::cancel, "lcod-run-cancel");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            var executor = new MacroExecutor(MacroLibrary.open(settings.macrosPath()), settings.limits());
            if (document != null) {
                return executor.executeYaml(read(document), parameters, session, sink, cancellation);
            }
            return executor.execute(target, parameters, session, sink, cancellation);
        } finally {
            Runtime.getRuntime().removeShutdownHook(hook);
        }
    }

    private void report(MacroResult result, PrintWriter out) throws IOException {
        if (json) {
            out.println(JSON_WRITER.writeValueAsString(result));
        } else if (result.success()) {
            out.println("OK: " + result.message());
        } else {
            out.println("FAILED: " + result.message());
            if (result.error() != null && !result.error().equals(result.message())) {
                out.println("  Error: " + result.error());
            }
            out.println("  Steps completed: " + result.stepsExecuted() + "/" + result.totalSteps());
        }
        out.flush();
    }

    private Path documentPath() {
        var lower = target.toLowerCase(Locale.ROOT);
        if (!lower.endsWith(".yaml") && !lower.endsWith(".yml")) {
            return null;
        }
        var path = Path.of(target);
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Macro document not found: " + path.toAbsolutePath());
        }
        return path;
    }

    private static String read(Path document) throws IOException {
        return Files.readString(document, StandardCharsets.UTF_8);
    }
}
