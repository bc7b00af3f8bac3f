package work.lcod.automation.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

final class Strings {
    private Strings() {}

    static String map(String value, UnaryOperator<String> fn) {
        return value == null ? null : fn.apply(value);
    }

    static List<String> map(List<String> values, UnaryOperator<String> fn) {
        if (values == null) return null;
        var copy = new ArrayList<String>(values.size());
        for (var value : values) {
            copy.add(map(value, fn));
        }
        return List.copyOf(copy);
    }

    static Map<String, String> mapValues(Map<String, String> values, UnaryOperator<String> fn) {
        if (values == null) return null;
        var copy = new LinkedHashMap<String, String>();
        for (var entry : values.entrySet()) {
            copy.put(entry.getKey(), map(entry.getValue(), fn));
        }
        return copy;
    }
}
