package work.lcod.automation.runtime;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Comparison used by {@code verify}. Every mode ignores case.
 */
public enum MatchMode {
    EQUALS("equals", "=") {
        @Override
        public boolean matches(String actual, String expected) {
            return actual.equalsIgnoreCase(expected);
        }
    },
    CONTAINS("contains", "to contain") {
        @Override
        public boolean matches(String actual, String expected) {
            return actual.toLowerCase(Locale.ROOT).contains(expected.toLowerCase(Locale.ROOT));
        }
    },
    NOT_EQUALS("not_equals", "!=") {
        @Override
        public boolean matches(String actual, String expected) {
            return !actual.equalsIgnoreCase(expected);
        }
    },
    REGEX("regex", "to match pattern") {
        @Override
        public boolean matches(String actual, String expected) {
            return Pattern.compile(expected, Pattern.CASE_INSENSITIVE).matcher(actual).find();
        }
    },
    STARTS_WITH("starts_with", "to start with") {
        @Override
        public boolean matches(String actual, String expected) {
            return actual.regionMatches(true, 0, expected, 0, expected.length());
        }
    };

    private final String wireName;
    private final String description;

    MatchMode(String wireName, String description) {
        this.wireName = wireName;
        this.description = description;
    }

    public abstract boolean matches(String actual, String expected);

    public String wireName() {
        return wireName;
    }

    /** Phrase used in failure messages, e.g. {@code expected Name to contain "x"}. */
    public String description() {
        return description;
    }

    /** Mode named by {@code raw}; {@link #EQUALS} when absent. */
    public static Optional<MatchMode> fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.of(EQUALS);
        }
        var normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(mode -> mode.wireName.equals(normalized)).findFirst();
    }

    public static String validNames() {
        return Arrays.stream(values()).map(MatchMode::wireName).collect(Collectors.joining(", "));
    }
}
