package work.lcod.automation.session;

import java.time.Duration;
import java.util.Objects;

/**
 * Start (or reuse) a target application and attach to it.
 *
 * @param ifNotRunning attach to an already running instance instead of starting a new one
 * @param timeout      how long to wait for the main window before giving up
 */
public record LaunchRequest(String exePath, String arguments, String workingDirectory, boolean ifNotRunning, Duration timeout) {
    public LaunchRequest {
        Objects.requireNonNull(exePath, "exePath");
        Objects.requireNonNull(timeout, "timeout");
    }
}
