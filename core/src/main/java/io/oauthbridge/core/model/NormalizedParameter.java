package io.oauthbridge.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered key → values mapping that abstracts over query-string and
 * form-body encoding.
 *
 * <p>
 * OAuth2 forbids repeating a request parameter, so {@link #uniqueValue}
 * answers {@code null} both for a missing key and for a key that arrived
 * more than once. {@link #all} still exposes every value.
 *
 * <p>
 * Immutable.
 */
public final class NormalizedParameter {

    private static final NormalizedParameter EMPTY = new NormalizedParameter(new LinkedHashMap<>());

    private final LinkedHashMap<String, List<String>> store;

    private NormalizedParameter(LinkedHashMap<String, List<String>> store) {
        this.store = store;
    }

    /**
     * The value of {@code key} if it occurred exactly once.
     *
     * @return the value, or {@code null} if absent or repeated
     */
    public String uniqueValue(String key) {
        List<String> values = store.get(key);
        return values != null && values.size() == 1 ? values.get(0) : null;
    }

    /** Every value of {@code key} in arrival order; empty if absent. */
    public List<String> all(String key) {
        List<String> values = store.get(key);
        return values != null ? values : List.of();
    }

    public boolean contains(String key) {
        return store.containsKey(key);
    }

    /** Keys in first-arrival order. */
    public Set<String> keys() {
        return Collections.unmodifiableSet(store.keySet());
    }

    public boolean isEmpty() {
        return store.isEmpty();
    }

    public int size() {
        return store.size();
    }

    public Map<String, List<String>> toMultiValueMap() {
        return Collections.unmodifiableMap(store);
    }

    public static NormalizedParameter empty() {
        return EMPTY;
    }

    /** Single value per key, in the map's iteration order. */
    public static NormalizedParameter of(Map<String, String> singleValue) {
        LinkedHashMap<String, List<String>> map = new LinkedHashMap<>();
        singleValue.forEach((key, value) -> map.put(key, List.of(value)));
        return map.isEmpty() ? EMPTY : new NormalizedParameter(map);
    }

    /** Copies a parsed multi-valued map; keys without values are dropped. */
    public static NormalizedParameter ofMulti(Map<String, List<String>> multiValue) {
        LinkedHashMap<String, List<String>> map = new LinkedHashMap<>();
        multiValue.forEach((key, values) -> {
            if (values != null && !values.isEmpty()) {
                map.put(key, List.copyOf(values));
            }
        });
        return map.isEmpty() ? EMPTY : new NormalizedParameter(map);
    }

    /** Builds from key/value pairs in order: {@code pairs("a", "1", "b", "2")}. */
    public static NormalizedParameter pairs(String... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs, got " + keysAndValues.length + " strings");
        }
        LinkedHashMap<String, List<String>> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.computeIfAbsent(keysAndValues[i], key -> new ArrayList<>()).add(keysAndValues[i + 1]);
        }
        LinkedHashMap<String, List<String>> frozen = new LinkedHashMap<>();
        map.forEach((key, values) -> frozen.put(key, List.copyOf(values)));
        return frozen.isEmpty() ? EMPTY : new NormalizedParameter(frozen);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalizedParameter that)) return false;
        return store.equals(that.store);
    }

    @Override
    public int hashCode() {
        return store.hashCode();
    }

    @Override
    public String toString() {
        return "NormalizedParameter" + store;
    }
}
