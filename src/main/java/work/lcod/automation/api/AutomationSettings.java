package work.lcod.automation.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.lcod.automation.runtime.ExecutionLimits;
import work.lcod.automation.shared.DurationParser;

/**
 * Immutable runtime configuration. Values come from the built-in defaults, then an optional TOML
 * file, then the environment ({@code LCOD_MACROS_PATH}), then command-line options.
 *
 * <pre>
 * [macros]
 * path = "macros"
 *
 * [execution]
 * macro_timeout = "60s"
 * step_timeout = 5
 * retry_interval = "500ms"
 * launch_timeout = "60s"
 * window_poll = "500ms"
 *
 * [server]
 * host = "127.0.0.1"
 * port = 47100
 * max_connections = 5
 * idle_timeout = "5m"
 * </pre>
 */
public record AutomationSettings(
    Path macrosPath,
    ExecutionLimits limits,
    String host,
    int port,
    int maxConnections,
    Optional<Duration> idleTimeout,
    LogLevel logLevel
) {
    public static final String MACROS_PATH_ENV = "LCOD_MACROS_PATH";
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 47100;
    public static final int DEFAULT_MAX_CONNECTIONS = 5;

    public AutomationSettings {
        Objects.requireNonNull(macrosPath, "macrosPath");
        Objects.requireNonNull(limits, "limits");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        Objects.requireNonNull(logLevel, "logLevel");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("max_connections must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults overlaid with {@code configFile} (when present) and the environment.
     *
     * @throws IllegalArgumentException when the file cannot be read or is not valid TOML
     */
    public static Builder load(Path configFile, Map<String, String> environment) {
        var builder = builder();
        if (configFile != null) {
            builder.applyToml(configFile);
        }
        var envPath = environment == null ? null : environment.get(MACROS_PATH_ENV);
        if (envPath != null && !envPath.isBlank()) {
            builder.macrosPath(Path.of(envPath.trim()));
        }
        return builder;
    }

    public static final class Builder {
        private Path macrosPath = Path.of("macros");
        private Duration macroTimeout = ExecutionLimits.DEFAULTS.macroTimeout();
        private Duration stepTimeout = ExecutionLimits.DEFAULTS.stepTimeout();
        private Duration retryInterval = ExecutionLimits.DEFAULTS.retryInterval();
        private Duration launchTimeout = ExecutionLimits.DEFAULTS.launchTimeout();
        private Duration windowPoll = ExecutionLimits.DEFAULTS.windowPoll();
        private int snapshotDepth = ExecutionLimits.DEFAULTS.snapshotDepth();
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        private Optional<Duration> idleTimeout = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder macrosPath(Path macrosPath) {
            this.macrosPath = macrosPath;
            return this;
        }

        public Builder macroTimeout(Duration macroTimeout) {
            this.macroTimeout = macroTimeout;
            return this;
        }

        public Builder stepTimeout(Duration stepTimeout) {
            this.stepTimeout = stepTimeout;
            return this;
        }

        public Builder retryInterval(Duration retryInterval) {
            this.retryInterval = retryInterval;
            return this;
        }

        public Builder launchTimeout(Duration launchTimeout) {
            this.launchTimeout = launchTimeout;
            return this;
        }

        public Builder windowPoll(Duration windowPoll) {
            this.windowPoll = windowPoll;
            return this;
        }

        public Builder snapshotDepth(int snapshotDepth) {
            this.snapshotDepth = snapshotDepth;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder idleTimeout(Optional<Duration> idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder applyToml(Path file) {
            TomlParseResult toml;
            try {
                toml = Toml.parse(file);
            } catch (IOException ex) {
                throw new IllegalArgumentException("Failed to read configuration " + file + ": " + ex.getMessage(), ex);
            }
            if (toml.hasErrors()) {
                var errors = toml.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
                throw new IllegalArgumentException("Invalid configuration " + file + ": " + errors);
            }
            var base = file.toAbsolutePath().getParent();
            var path = toml.getString("macros.path");
            if (path != null && !path.isBlank()) {
                var configured = Path.of(path);
                macrosPath = configured.isAbsolute() || base == null ? configured : base.resolve(configured);
            }
            duration(toml, "execution.macro_timeout").ifPresent(this::macroTimeout);
            duration(toml, "execution.step_timeout").ifPresent(this::stepTimeout);
            duration(toml, "execution.retry_interval").ifPresent(this::retryInterval);
            duration(toml, "execution.launch_timeout").ifPresent(this::launchTimeout);
            duration(toml, "execution.window_poll").ifPresent(this::windowPoll);
            integer(toml, "execution.snapshot_depth").ifPresent(this::snapshotDepth);
            var configuredHost = toml.getString("server.host");
            if (configuredHost != null && !configuredHost.isBlank()) {
                host = configuredHost;
            }
            integer(toml, "server.port").ifPresent(this::port);
            integer(toml, "server.max_connections").ifPresent(this::maxConnections);
            var idle = duration(toml, "server.idle_timeout");
            if (idle.isPresent()) {
                idleTimeout = idle.get().isZero() ? Optional.empty() : idle;
            }
            var level = toml.getString("logging.level");
            if (level != null) {
                logLevel = LogLevel.from(level);
            }
            return this;
        }

        public AutomationSettings build() {
            return new AutomationSettings(
                macrosPath,
                new ExecutionLimits(macroTimeout, stepTimeout, retryInterval, launchTimeout, windowPoll, snapshotDepth),
                host,
                port,
                maxConnections,
                idleTimeout,
                logLevel
            );
        }

        private static Optional<Duration> duration(TomlParseResult toml, String key) {
            var value = toml.get(key);
            if (value == null) {
                return Optional.empty();
            }
            if (value instanceof Number number) {
                return Optional.of(DurationParser.ofSeconds(number.doubleValue()));
            }
            if (value instanceof String text) {
                return DurationParser.parse(text);
            }
            throw new IllegalArgumentException("'" + key + "' must be a duration");
        }

        private static Optional<Integer> integer(TomlParseResult toml, String key) {
            var value = toml.get(key);
            if (value == null) {
                return Optional.empty();
            }
            if (value instanceof Long number) {
                return Optional.of(Math.toIntExact(number));
            }
            throw new IllegalArgumentException("'" + key + "' must be an integer");
        }
    }

    /** True when {@code file} exists and should be read. */
    public static boolean isReadable(Path file) {
        return file != null && Files.isRegularFile(file);
    }
}
