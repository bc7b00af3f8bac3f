package work.lcod.automation.shared;

import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code {{name}}} placeholder handling shared by include remapping and step execution.
 * Replacement is a single left-to-right pass: substituted text is never rescanned and
 * placeholders without a value are kept verbatim.
 */
public final class Placeholders {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)\\}\\}");

    private Placeholders() {}

    public static String substitute(String template, Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return template;
        }
        return substitute(template, values::get);
    }

    public static String substitute(String template, Function<String, String> lookup) {
        if (template == null || template.indexOf("{{") < 0) {
            return template;
        }
        var matcher = PLACEHOLDER.matcher(template);
        var out = new StringBuilder(template.length());
        while (matcher.find()) {
            var value = lookup.apply(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value == null ? matcher.group() : value));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
