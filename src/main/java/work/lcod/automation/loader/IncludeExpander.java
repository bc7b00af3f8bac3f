package work.lcod.automation.loader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.UnaryOperator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.automation.model.LoadError;
import work.lcod.automation.model.MacroDefinition;
import work.lcod.automation.model.Step;
import work.lcod.automation.shared.Placeholders;

/**
 * Inlines {@code include} steps once per load pass. The walk keeps the chain of macros being
 * expanded so that the same macro may be included along different branches while a macro that
 * reaches itself is rejected. A macro whose expansion fails is dropped from the table.
 */
public final class IncludeExpander {
    private static final Logger log = LogManager.getLogger(IncludeExpander.class);

    private final Map<String, MacroDefinition> table;
    private final Map<String, List<Step>> expanded = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    private IncludeExpander(Map<String, MacroDefinition> table) {
        this.table = table;
    }

    /**
     * @param table   macros keyed by canonical name, looked up case-insensitively
     * @param sources relative document path per canonical name, used for error reports
     */
    public static Expansion expand(Map<String, MacroDefinition> table, Map<String, String> sources) {
        var lookup = new TreeMap<String, MacroDefinition>(String.CASE_INSENSITIVE_ORDER);
        lookup.putAll(table);
        var expander = new IncludeExpander(lookup);
        var result = new TreeMap<String, MacroDefinition>(String.CASE_INSENSITIVE_ORDER);
        var errors = new ArrayList<LoadError>();
        for (var entry : lookup.entrySet()) {
            var name = entry.getKey();
            var definition = entry.getValue();
            if (!definition.hasIncludes()) {
                result.put(name, definition);
                continue;
            }
            try {
                var chain = new ArrayList<String>();
                chain.add(name);
                result.put(name, definition.withSteps(expander.stepsOf(name, definition, chain)));
            } catch (IncludeException ex) {
                log.warn("Dropping macro '{}': {}", name, ex.getMessage());
                errors.add(new LoadError(sources.getOrDefault(name, ""), name, ex.getMessage()));
            }
        }
        return new Expansion(Collections.unmodifiableMap(result), List.copyOf(errors));
    }

    private List<Step> stepsOf(String name, MacroDefinition definition, List<String> chain) {
        var cached = expanded.get(name);
        if (cached != null) {
            return cached;
        }
        var steps = new ArrayList<Step>();
        for (var step : definition.steps()) {
            if (!(step instanceof Step.Include include)) {
                steps.add(step);
                continue;
            }
            var target = include.macroName();
            if (containsIgnoreCase(chain, target)) {
                throw new IncludeException("Circular include detected: " + String.join(" -> ", chain) + " -> " + target);
            }
            var targetDefinition = table.get(target);
            if (targetDefinition == null) {
                throw new IncludeException("include references unknown macro '" + target + "'");
            }
            chain.add(target);
            var childSteps = stepsOf(target, targetDefinition, chain);
            chain.remove(chain.size() - 1);
            var remap = remapper(include.params());
            for (var child : childSteps) {
                steps.add(remap == null ? child : child.mapStrings(remap));
            }
        }
        var result = List.copyOf(steps);
        expanded.put(name, result);
        return result;
    }

    private static UnaryOperator<String> remapper(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return null;
        }
        var byName = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        params.forEach((key, value) -> {
            if (value != null) {
                byName.put(key, value);
            }
        });
        return value -> Placeholders.substitute(value, byName::get);
    }

    private static boolean containsIgnoreCase(List<String> chain, String name) {
        for (var entry : chain) {
            if (entry.equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    /** Expanded table plus one error per dropped macro. */
    public record Expansion(Map<String, MacroDefinition> macros, List<LoadError> errors) {}

    private static final class IncludeException extends RuntimeException {
        IncludeException(String message) {
            super(message);
        }
    }
}
