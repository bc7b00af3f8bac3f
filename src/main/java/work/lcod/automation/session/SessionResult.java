package work.lcod.automation.session;

/**
 * Uniform result of a backend call: a success flag, an optional payload and a human-readable message.
 */
public record SessionResult<T>(boolean success, T value, String message) {
    public SessionResult {
        message = message == null ? "" : message;
    }

    public static <T> SessionResult<T> ok(T value, String message) {
        return new SessionResult<>(true, value, message);
    }

    public static SessionResult<String> ok(String message) {
        return new SessionResult<>(true, message, message);
    }

    public static <T> SessionResult<T> failure(String message) {
        return new SessionResult<>(false, null, message);
    }
}
