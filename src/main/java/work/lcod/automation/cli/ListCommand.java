package work.lcod.automation.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.PrintWriter;
import java.time.Duration;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.automation.loader.MacroLibrary;
import work.lcod.automation.rpc.MacroListing;
import work.lcod.automation.rpc.RemoteSession;
import work.lcod.automation.rpc.RpcClient;

@CommandLine.Command(
    name = "list",
    description = "List the available macros and the documents that failed to load.",
    mixinStandardHelpOptions = true
)
final class ListCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();
    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    @CommandLine.Mixin
    private CommonOptions common;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--connect",
        paramLabel = "HOST[:PORT]",
        description = "List the macros of a running server instead of the local directory.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String connect;

    @CommandLine.Option(names = "--json", description = "Print the listing as JSON.")
    private boolean json;

    @Override
    public Integer call() throws Exception {
        var settings = common.resolve();
        MacroListing listing;
        if (connect != null) {
            var endpoint = Endpoint.parse(connect, settings.port());
            try (var client = RpcClient.connect(endpoint.host(), endpoint.port(), CONNECT_TIMEOUT)) {
                listing = new RemoteSession(client, CONNECT_TIMEOUT).listMacros();
            }
        } else {
            var library = MacroLibrary.open(settings.macrosPath());
            listing = new MacroListing(library.list(), library.loadErrors());
        }

        var out = spec.commandLine().getOut();
        if (json) {
            out.println(JSON_WRITER.writeValueAsString(listing));
        } else {
            print(listing, out);
        }
        out.flush();
        return 0;
    }

    static void print(MacroListing listing, PrintWriter out) {
        if (listing.macros().isEmpty() && listing.loadErrors().isEmpty()) {
            out.println("No macros found. Place .yaml files in the macros directory.");
            return;
        }
        if (!listing.macros().isEmpty()) {
            out.println("Available macros (" + listing.macros().size() + "):");
            for (var macro : listing.macros()) {
                out.println("  " + macro.name() + " - " + macro.description());
                for (var parameter : macro.parameters()) {
                    out.println("    " + parameter.name()
                        + (parameter.required() ? " (required)" : "")
                        + " - " + parameter.description()
                        + (parameter.defaultValue() != null ? " [default: " + parameter.defaultValue() + "]" : ""));
                }
            }
        }
        if (!listing.loadErrors().isEmpty()) {
            out.println();
            out.println("Load errors (" + listing.loadErrors().size() + "):");
            for (var error : listing.loadErrors()) {
                out.println("  " + error.filePath() + ": " + error.message());
            }
        }
    }
}
