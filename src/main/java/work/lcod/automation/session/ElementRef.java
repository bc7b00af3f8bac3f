package work.lcod.automation.session;

/**
 * A located element as seen by callers: the cache key other calls accept plus a short description.
 */
public record ElementRef(String refKey, String description) {}
