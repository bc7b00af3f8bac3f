package work.lcod.automation.loader;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.automation.model.ElementCriteria;
import work.lcod.automation.model.MacroValidationException;
import work.lcod.automation.model.Step;
import work.lcod.automation.model.StepAction;
import work.lcod.automation.model.StepTiming;

/**
 * Turns validated raw step maps into typed {@link Step} records.
 */
public final class StepFactory {
    private StepFactory() {}

    public static List<Step> fromMaps(List<Map<String, Object>> rawSteps) {
        var steps = new ArrayList<Step>(rawSteps.size());
        for (int i = 0; i < rawSteps.size(); i++) {
            steps.add(fromMap(i + 1, rawSteps.get(i)));
        }
        return steps;
    }

    public static Step fromMap(int number, Map<String, Object> raw) {
        var actionName = String.valueOf(raw.get("action"));
        var action = StepAction.fromName(actionName)
            .orElseThrow(() -> new MacroValidationException("Step " + number + ": unknown action '" + actionName + "'"));
        var fields = new Fields(number, action, raw);
        var timing = new StepTiming(fields.integer("timeout"), fields.decimal("retry_interval"));
        return switch (action) {
            case FOCUS -> new Step.Focus(timing);
            case ATTACH -> new Step.Attach(fields.string("process_name"), fields.integer("pid"), timing);
            case SNAPSHOT -> new Step.Snapshot(fields.integer("max_depth"), timing);
            case FIND -> new Step.Find(fields.criteria(), fields.string("save_as"), timing);
            case FIND_BY_PATH -> new Step.FindByPath(fields.stringList("path"), fields.string("save_as"), timing);
            case CLICK -> new Step.Click(fields.string("ref"), timing);
            case RIGHT_CLICK -> new Step.RightClick(fields.string("ref"), timing);
            case TYPE -> new Step.TypeText(fields.string("text"), timing);
            case SET_VALUE -> new Step.SetValue(fields.string("ref"), fields.string("value"), timing);
            case GET_VALUE -> new Step.GetValue(fields.string("ref"), timing);
            case SEND_KEYS -> new Step.SendKeys(fields.string("keys"), timing);
            case WAIT -> {
                var seconds = fields.decimal("seconds");
                yield new Step.Wait(seconds == null ? 1.0 : seconds, timing);
            }
            case WAIT_FOR_ENABLED -> new Step.WaitForEnabled(
                fields.criteria(), fields.string("ref"), fields.bool("enabled"), fields.string("save_as"), timing);
            case MACRO -> new Step.CallMacro(fields.string("macro_name"), fields.stringMap("params"), timing);
            case INCLUDE -> new Step.Include(fields.string("macro_name"), fields.stringMap("params"), timing);
            case LAUNCH -> new Step.Launch(
                fields.string("exe_path"),
                fields.string("arguments"),
                fields.string("working_directory"),
                fields.bool("if_not_running"),
                timing
            );
            case WAIT_FOR_WINDOW -> new Step.WaitForWindow(fields.string("title_contains"), fields.criteria(), timing);
            case SCREENSHOT -> new Step.Screenshot(timing);
            case PROPERTIES -> new Step.Properties(fields.string("ref"), timing);
            case CHILDREN -> new Step.Children(fields.string("ref"), fields.string("save_as"), timing);
            case FILE_DIALOG -> new Step.FileDialog(fields.string("text"), timing);
            case VERIFY -> new Step.Verify(
                fields.string("ref"),
                fields.string("property"),
                fields.string("expected"),
                fields.string("match_mode"),
                fields.string("message"),
                timing
            );
        };
    }

    private record Fields(int number, StepAction action, Map<String, Object> raw) {
        String string(String key) {
            var value = raw.get(key);
            if (value == null) return null;
            if (value instanceof Map<?, ?> || value instanceof List<?>) {
                throw typeError(key, "a string");
            }
            return String.valueOf(value);
        }

        Integer integer(String key) {
            var value = raw.get(key);
            if (value == null) return null;
            if (value instanceof Number num) {
                if (num.doubleValue() != Math.rint(num.doubleValue())) {
                    throw typeError(key, "an integer");
                }
                return num.intValue();
            }
            if (value instanceof String str) {
                try {
                    return Integer.parseInt(str.trim());
                } catch (NumberFormatException ex) {
                    throw typeError(key, "an integer");
                }
            }
            throw typeError(key, "an integer");
        }

        Double decimal(String key) {
            var value = raw.get(key);
            if (value == null) return null;
            if (value instanceof Number num) {
                return num.doubleValue();
            }
            if (value instanceof String str) {
                try {
                    return Double.parseDouble(str.trim());
                } catch (NumberFormatException ex) {
                    throw typeError(key, "a number");
                }
            }
            throw typeError(key, "a number");
        }

        Boolean bool(String key) {
            var value = raw.get(key);
            if (value == null) return null;
            if (value instanceof Boolean b) return b;
            if (value instanceof String str) {
                if ("true".equalsIgnoreCase(str.trim())) return Boolean.TRUE;
                if ("false".equalsIgnoreCase(str.trim())) return Boolean.FALSE;
            }
            throw typeError(key, "a boolean");
        }

        List<String> stringList(String key) {
            var value = raw.get(key);
            if (value == null) return null;
            if (!(value instanceof List<?> list)) {
                throw typeError(key, "a list");
            }
            var result = new ArrayList<String>(list.size());
            for (var item : list) {
                result.add(item == null ? "" : String.valueOf(item));
            }
            return List.copyOf(result);
        }

        Map<String, String> stringMap(String key) {
            var value = raw.get(key);
            if (value == null) return null;
            if (!(value instanceof Map<?, ?> map)) {
                throw typeError(key, "a mapping");
            }
            var result = new LinkedHashMap<String, String>();
            for (var entry : map.entrySet()) {
                result.put(String.valueOf(entry.getKey()), entry.getValue() == null ? null : String.valueOf(entry.getValue()));
            }
            return result;
        }

        ElementCriteria criteria() {
            return new ElementCriteria(string("automation_id"), string("name"), string("class_name"), string("control_type"));
        }

        private MacroValidationException typeError(String key, String expected) {
            return new MacroValidationException(
                "Step " + number + " (" + action.wireName() + "): field '" + key + "' must be " + expected);
        }
    }
}
