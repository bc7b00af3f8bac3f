package work.lcod.automation.cli;

import java.nio.file.Path;
import picocli.CommandLine;
import work.lcod.automation.api.AutomationSettings;
import work.lcod.automation.api.LogLevel;

/**
 * Options shared by every subcommand. Precedence: command line, then environment, then the
 * configuration file, then built-in defaults.
 */
final class CommonOptions {
    static final Path DEFAULT_CONFIG = Path.of("lcod-automation.toml");

    @CommandLine.Option(
        names = "--config",
        description = "TOML configuration file (default: ./lcod-automation.toml when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path config;

    @CommandLine.Option(
        names = {"-m", "--macros"},
        description = "Macros directory (overrides the configuration file and LCOD_MACROS_PATH).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path macros;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostic log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String logLevelRaw;

    AutomationSettings.Builder settings() {
        Path file = null;
        if (config != null) {
            if (!AutomationSettings.isReadable(config)) {
                throw new IllegalArgumentException("Configuration file not found: " + config.toAbsolutePath());
            }
            file = config;
        } else if (AutomationSettings.isReadable(DEFAULT_CONFIG)) {
            file = DEFAULT_CONFIG;
        }
        var builder = AutomationSettings.load(file, System.getenv());
        if (macros != null) {
            builder.macrosPath(macros);
        }
        if (logLevelRaw != null) {
            builder.logLevel(LogLevel.from(logLevelRaw));
        }
        return builder;
    }

    /** Resolved settings with the log threshold already applied. */
    AutomationSettings resolve() {
        var settings = settings().build();
        settings.logLevel().apply();
        return settings;
    }
}
