package work.lcod.automation.model;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Checks raw step maps (as read from a document or received over the wire) before they are accepted.
 * Stops at the first offending step; step numbers in messages are 1-based.
 */
public final class StepValidator {
    private static final String[] FIND_FIELDS = {"automation_id", "name", "control_type", "class_name"};
    private static final String[] WAIT_FOR_ENABLED_FIELDS = {"automation_id", "name", "control_type", "class_name", "ref"};

    private StepValidator() {}

    public static Optional<String> validate(List<Map<String, Object>> steps) {
        if (steps == null || steps.isEmpty()) {
            return Optional.of("Macro must have at least one step");
        }
        for (int i = 0; i < steps.size(); i++) {
            var step = steps.get(i);
            int number = i + 1;
            var rawAction = step == null ? null : step.get("action");
            if (!(rawAction instanceof String action) || action.isEmpty()) {
                return Optional.of("Step " + number + ": missing 'action' field");
            }
            var resolved = StepAction.fromName(action);
            if (resolved.isEmpty()) {
                return Optional.of("Step " + number + ": unknown action '" + action + "'. Valid actions: "
                    + String.join(", ", StepAction.acceptedNames()));
            }
            var reason = checkFields(resolved.get(), step);
            if (reason != null) {
                return Optional.of("Step " + number + " (" + action.toLowerCase(Locale.ROOT) + "): " + reason);
            }
        }
        return Optional.empty();
    }

    private static String checkFields(StepAction action, Map<String, Object> step) {
        return switch (action) {
            case SEND_KEYS -> requires(step, "keys");
            case FIND -> requiresAny(step, FIND_FIELDS);
            case FIND_BY_PATH -> requires(step, "path");
            case TYPE -> requires(step, "text");
            case SET_VALUE -> firstMissing(step, "ref", "value");
            case WAIT -> requires(step, "seconds");
            case MACRO, INCLUDE -> requires(step, "macro_name");
            case WAIT_FOR_WINDOW -> requires(step, "title_contains");
            case WAIT_FOR_ENABLED -> requiresAny(step, WAIT_FOR_ENABLED_FIELDS);
            case FILE_DIALOG -> has(step, "text") ? null : "requires 'text' field (the file path)";
            case ATTACH -> requiresAny(step, "process_name", "pid");
            case VERIFY -> firstMissing(step, "ref", "property", "expected");
            case FOCUS, SNAPSHOT, CLICK, RIGHT_CLICK, GET_VALUE, LAUNCH, SCREENSHOT, PROPERTIES, CHILDREN -> null;
        };
    }

    private static String requires(Map<String, Object> step, String field) {
        return has(step, field) ? null : "requires '" + field + "' field";
    }

    private static String firstMissing(Map<String, Object> step, String... fields) {
        for (var field : fields) {
            if (!has(step, field)) {
                return "requires '" + field + "' field";
            }
        }
        return null;
    }

    private static String requiresAny(Map<String, Object> step, String... fields) {
        for (var field : fields) {
            if (has(step, field)) {
                return null;
            }
        }
        return "requires at least one of: " + String.join(", ", fields);
    }

    static boolean has(Map<String, Object> step, String field) {
        var value = step.get(field);
        if (value == null) return false;
        return !(value instanceof String str) || !str.isEmpty();
    }
}
