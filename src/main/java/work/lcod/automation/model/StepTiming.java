package work.lcod.automation.model;

import java.time.Duration;
import java.util.Optional;

/**
 * Optional per-step overrides ({@code timeout} in seconds, {@code retry_interval} in seconds).
 */
public record StepTiming(Integer timeoutSeconds, Double retryIntervalSeconds) {
    public static final StepTiming DEFAULT = new StepTiming(null, null);

    public Optional<Duration> timeout() {
        if (timeoutSeconds == null || timeoutSeconds <= 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofSeconds(timeoutSeconds));
    }

    public Optional<Duration> retryInterval() {
        if (retryIntervalSeconds == null || retryIntervalSeconds <= 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(Math.round(retryIntervalSeconds * 1000)));
    }
}
