package work.lcod.automation.runtime;

import java.time.Duration;
import java.util.Objects;

/**
 * Time budgets applied when a macro or step does not declare its own.
 *
 * @param macroTimeout  whole-macro budget
 * @param stepTimeout   per-step budget
 * @param retryInterval pause between attempts of {@code find}, {@code find_by_path} and {@code wait_for_enabled}
 * @param launchTimeout per-step budget of {@code launch} and {@code wait_for_window}
 * @param windowPoll    poll interval of {@code wait_for_window}
 * @param snapshotDepth tree depth of {@code snapshot}
 */
public record ExecutionLimits(
    Duration macroTimeout,
    Duration stepTimeout,
    Duration retryInterval,
    Duration launchTimeout,
    Duration windowPoll,
    int snapshotDepth
) {
    public static final ExecutionLimits DEFAULTS = new ExecutionLimits(
        Duration.ofSeconds(60),
        Duration.ofSeconds(5),
        Duration.ofMillis(500),
        Duration.ofSeconds(60),
        Duration.ofMillis(500),
        3
    );

    public ExecutionLimits {
        Objects.requireNonNull(macroTimeout, "macroTimeout");
        Objects.requireNonNull(stepTimeout, "stepTimeout");
        Objects.requireNonNull(retryInterval, "retryInterval");
        Objects.requireNonNull(launchTimeout, "launchTimeout");
        Objects.requireNonNull(windowPoll, "windowPoll");
        if (snapshotDepth <= 0) {
            throw new IllegalArgumentException("snapshotDepth must be positive");
        }
    }
}
