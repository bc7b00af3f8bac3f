package work.lcod.automation.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.lcod.automation.model.MacroDefinition;
import work.lcod.automation.model.MacroValidationException;
import work.lcod.automation.model.ParameterSpec;
import work.lcod.automation.model.StepValidator;

/**
 * Reads a macro document ({@code name, description, timeout, parameters, steps}) into a
 * {@link MacroDefinition}. Unknown keys are ignored.
 */
public final class MacroDocumentParser {
    static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private MacroDocumentParser() {}

    /**
     * @return the parsed macro, or empty when the document holds nothing
     * @throws IOException when the document is not well-formed YAML
     * @throws MacroValidationException when the document is well-formed but not a valid macro
     */
    public static Optional<MacroDefinition> parse(InputStream in) throws IOException {
        return fromTree(YAML_MAPPER.readTree(in));
    }

    public static Optional<MacroDefinition> parse(String content) throws IOException {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        return fromTree(YAML_MAPPER.readTree(content));
    }

    private static Optional<MacroDefinition> fromTree(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return Optional.empty();
        }
        if (!root.isObject()) {
            throw new MacroValidationException("Macro document must be a mapping");
        }
        var document = toMap(root);
        return Optional.of(fromMap(document));
    }

    static MacroDefinition fromMap(Map<String, Object> document) {
        var rawSteps = rawSteps(document.get("steps"));
        if (rawSteps.isEmpty()) {
            return new MacroDefinition(text(document.get("name")), text(document.get("description")),
                timeout(document.get("timeout")), parameters(document.get("parameters")), List.of());
        }
        StepValidator.validate(rawSteps).ifPresent(error -> {
            throw new MacroValidationException(error);
        });
        return new MacroDefinition(
            text(document.get("name")),
            text(document.get("description")),
            timeout(document.get("timeout")),
            parameters(document.get("parameters")),
            StepFactory.fromMaps(rawSteps)
        );
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> rawSteps(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new MacroValidationException("'steps' must be a list");
        }
        var steps = new ArrayList<Map<String, Object>>(list.size());
        for (int i = 0; i < list.size(); i++) {
            var item = list.get(i);
            if (!(item instanceof Map<?, ?> map)) {
                throw new MacroValidationException("Step " + (i + 1) + ": must be a mapping");
            }
            steps.add((Map<String, Object>) map);
        }
        return steps;
    }

    private static List<ParameterSpec> parameters(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new MacroValidationException("'parameters' must be a list");
        }
        var specs = new ArrayList<ParameterSpec>();
        var seen = new HashSet<String>();
        for (var item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                throw new MacroValidationException("Each parameter must be a mapping");
            }
            var name = text(map.get("name"));
            if (name.isBlank()) {
                throw new MacroValidationException("Parameter is missing 'name'");
            }
            if (!seen.add(name)) {
                throw new MacroValidationException("Duplicate parameter '" + name + "'");
            }
            var required = map.get("required");
            var defaultValue = map.get("default");
            specs.add(new ParameterSpec(
                name,
                text(map.get("description")),
                Boolean.TRUE.equals(required) || "true".equalsIgnoreCase(String.valueOf(required)),
                defaultValue == null ? null : String.valueOf(defaultValue)
            ));
        }
        return specs;
    }

    private static int timeout(Object value) {
        if (value == null) return 0;
        if (value instanceof Number num) return num.intValue();
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException ex) {
            throw new MacroValidationException("'timeout' must be an integer number of seconds");
        }
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    static Map<String, Object> toMap(JsonNode node) {
        var map = new LinkedHashMap<String, Object>();
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            map.put(entry.getKey(), convertNode(entry.getValue()));
        }
        return map;
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            return toMap(node);
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
