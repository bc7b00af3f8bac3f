package work.lcod.automation.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Fixed step vocabulary understood by the validator and the interpreter.
 */
public enum StepAction {
    FOCUS("focus"),
    ATTACH("attach"),
    SNAPSHOT("snapshot"),
    FIND("find"),
    FIND_BY_PATH("find_by_path"),
    CLICK("click"),
    RIGHT_CLICK("right_click"),
    TYPE("type"),
    SET_VALUE("set_value"),
    GET_VALUE("get_value"),
    SEND_KEYS("send_keys"),
    WAIT("wait"),
    WAIT_FOR_ENABLED("wait_for_enabled"),
    MACRO("macro"),
    INCLUDE("include"),
    LAUNCH("launch"),
    WAIT_FOR_WINDOW("wait_for_window"),
    SCREENSHOT("screenshot"),
    PROPERTIES("properties"),
    CHILDREN("children"),
    FILE_DIALOG("file_dialog"),
    VERIFY("verify");

    private static final String KEYS_ALIAS = "keys";

    private final String wireName;

    StepAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Actions that run whether or not the session is attached to a target process.
     */
    public boolean attachmentIndependent() {
        return switch (this) {
            case ATTACH, WAIT, MACRO, INCLUDE, LAUNCH, WAIT_FOR_WINDOW -> true;
            default -> false;
        };
    }

    public static Optional<StepAction> fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (KEYS_ALIAS.equals(normalized)) {
            return Optional.of(SEND_KEYS);
        }
        return Arrays.stream(values()).filter(a -> a.wireName.equals(normalized)).findFirst();
    }

    /** Every accepted action name, aliases included, in alphabetical order. */
    public static List<String> acceptedNames() {
        var names = new TreeSet<String>();
        for (var action : values()) {
            names.add(action.wireName);
        }
        names.add(KEYS_ALIAS);
        return List.copyOf(names);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
