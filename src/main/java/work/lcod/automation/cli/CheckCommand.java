package work.lcod.automation.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.automation.loader.MacroLibrary;

@CommandLine.Command(
    name = "check",
    description = "Load every macro document and report validation errors. Exits with 1 when any document fails.",
    mixinStandardHelpOptions = true
)
final class CheckCommand implements Callable<Integer> {
    @CommandLine.Mixin
    private CommonOptions common;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        var settings = common.resolve();
        var snapshot = MacroLibrary.open(settings.macrosPath()).snapshot();
        var out = spec.commandLine().getOut();
        for (var error : snapshot.loadErrors()) {
            out.println("ERROR " + error.filePath() + " (" + error.macroName() + "): " + error.message());
        }
        out.println(snapshot.macros().size() + " macro(s) loaded from " + snapshot.root()
            + ", " + snapshot.loadErrors().size() + " error(s)");
        out.flush();
        return snapshot.loadErrors().isEmpty() ? 0 : 1;
    }
}
