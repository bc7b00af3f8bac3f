package work.lcod.automation.model;

import java.util.ArrayList;
import java.util.function.UnaryOperator;

/**
 * Search criteria for a single UI element. Any subset of the fields may be set.
 */
public record ElementCriteria(String automationId, String name, String className, String controlType) {
    public static final ElementCriteria NONE = new ElementCriteria(null, null, null, null);

    public boolean isEmpty() {
        return automationId == null && name == null && className == null && controlType == null;
    }

    public ElementCriteria map(UnaryOperator<String> fn) {
        return new ElementCriteria(
            Strings.map(automationId, fn),
            Strings.map(name, fn),
            Strings.map(className, fn),
            Strings.map(controlType, fn)
        );
    }

    public String describe() {
        var parts = new ArrayList<String>();
        if (automationId != null) parts.add("automation_id=" + automationId);
        if (name != null) parts.add("name=" + name);
        if (className != null) parts.add("class_name=" + className);
        if (controlType != null) parts.add("control_type=" + controlType);
        return String.join(", ", parts);
    }
}
