package work.lcod.automation.runtime;

import java.util.Map;
import java.util.TreeMap;

/**
 * {@code save_as} names of one macro invocation, matched case-insensitively.
 */
final class AliasTable {
    private final Map<String, String> refs = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    void put(String alias, String refKey) {
        if (alias != null && refKey != null) {
            refs.put(alias, refKey);
        }
    }

    /** The reference saved under {@code refOrAlias}, or the argument itself when it is not an alias. */
    String resolve(String refOrAlias) {
        if (refOrAlias == null) {
            return null;
        }
        return refs.getOrDefault(refOrAlias, refOrAlias);
    }
}
