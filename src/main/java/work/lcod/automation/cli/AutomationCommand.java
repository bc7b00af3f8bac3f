package work.lcod.automation.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "lcod-automation",
    description = "Load, check and run UI automation macros, locally or through an automation server.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        ListCommand.class,
        CheckCommand.class,
        RunCommand.class,
        ServeCommand.class
    }
)
final class AutomationCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand.");
    }
}
