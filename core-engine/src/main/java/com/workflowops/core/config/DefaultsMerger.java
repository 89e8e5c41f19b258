package com.workflowops.core.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Defaults-then-override merge applied wherever a descriptor mapping pulls
 * in a shared block through a {@code <<} merge key.
 *
 * <p>
 * Rules, applied per key:
 * </p>
 * <ol>
 * <li>a key present in the overrides wins, even with a {@code null}
 * value;</li>
 * <li>otherwise the value comes from the defaults;</li>
 * <li>when both sides hold a mapping, the two mappings are merged
 * recursively with the same rules, so a task overriding one field of
 * {@code gcp_connection} keeps the other fields of the shared block.</li>
 * </ol>
 * <p>
 * Sequences and scalars are replaced wholesale: a task declaring its own
 * {@code libraries} does not inherit the default ones.
 * </p>
 *
 * @since 1.0.0
 */
public final class DefaultsMerger {

    private DefaultsMerger() {
    }

    /**
     * @param defaults  shared values; must not be {@code null}
     * @param overrides local values; must not be {@code null}
     * @return a new map, defaults keys first, then keys only present locally
     */
    public static Map<String, Object> merge(Map<String, ?> defaults, Map<String, ?> overrides) {
        Objects.requireNonNull(defaults, "defaults must not be null");
        Objects.requireNonNull(overrides, "overrides must not be null");

        Map<String, Object> merged = new LinkedHashMap<>(defaults);
        overrides.forEach((key, local) -> {
            Object shared = merged.get(key);
            if (shared instanceof Map<?, ?> sharedMap && local instanceof Map<?, ?> localMap) {
                merged.put(key, merge(asStringKeyed(sharedMap), asStringKeyed(localMap)));
            } else {
                merged.put(key, local);
            }
        });
        return merged;
    }

    /**
     * @param map a mapping read from a descriptor
     * @return a copy typed by its string keys
     * @throws IllegalArgumentException if a key is not a string
     */
    static Map<String, Object> asStringKeyed(Map<?, ?> map) {
        Map<String, Object> typed = new LinkedHashMap<>();
        map.forEach((key, value) -> {
            if (!(key instanceof String name)) {
                throw new IllegalArgumentException("Mapping keys must be strings, found key: " + key);
            }
            typed.put(name, value);
        });
        return typed;
    }
}
