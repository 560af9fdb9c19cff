package io.oauthbridge.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Raw request header collection as handed over by the HTTP framework.
 *
 * <p>
 * Names are matched case-insensitively and stored lowercase. Every value of
 * a repeated header is kept, in arrival order, because the request adapters
 * must be able to tell one {@code Authorization} header from two.
 *
 * <p>
 * Immutable; build instances with {@link #builder()}, {@link #of(Map)} or
 * {@link #ofMulti(Map)}.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(new LinkedHashMap<>());

    /** Lowercase name → non-empty list of values. */
    private final LinkedHashMap<String, List<String>> store;

    private HttpHeaders(LinkedHashMap<String, List<String>> store) {
        this.store = store;
    }

    /**
     * First value for a header name (case-insensitive).
     *
     * @return the first value, or {@code null} if the header is absent
     */
    public String first(String name) {
        List<String> values = store.get(normalize(name));
        return values != null && !values.isEmpty() ? values.get(0) : null;
    }

    /**
     * All values for a header name (case-insensitive).
     *
     * @return an unmodifiable list of values, or an empty list if absent
     */
    public List<String> all(String name) {
        List<String> values = store.get(normalize(name));
        return values != null ? values : List.of();
    }

    /** Number of values received for {@code name}. */
    public int count(String name) {
        return all(name).size();
    }

    public boolean contains(String name) {
        return store.containsKey(normalize(name));
    }

    public boolean isEmpty() {
        return store.isEmpty();
    }

    /** All-values-per-name view with lowercase keys, in arrival order. */
    public Map<String, List<String>> toMultiValueMap() {
        return Collections.unmodifiableMap(store);
    }

    public static HttpHeaders of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        singleValue.forEach(builder::add);
        return builder.build();
    }

    public static HttpHeaders ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        multiValue.forEach((name, values) -> values.forEach(value -> builder.add(name, value)));
        return builder.build();
    }

    public static HttpHeaders empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String normalize(String name) {
        return name == null ? null : name.toLowerCase(Locale.ROOT);
    }

    /** Accumulates header values; repeated names append. */
    public static final class Builder {

        private final LinkedHashMap<String, List<String>> values = new LinkedHashMap<>();

        private Builder() {}

        public Builder add(String name, String value) {
            if (name == null || value == null) {
                return this;
            }
            values.computeIfAbsent(normalize(name), key -> new ArrayList<>()).add(value);
            return this;
        }

        public HttpHeaders build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            LinkedHashMap<String, List<String>> frozen = new LinkedHashMap<>();
            values.forEach((name, list) -> frozen.put(name, List.copyOf(list)));
            return new HttpHeaders(frozen);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpHeaders that)) return false;
        return store.equals(that.store);
    }

    @Override
    public int hashCode() {
        return store.hashCode();
    }

    @Override
    public String toString() {
        return "HttpHeaders" + store.keySet();
    }
}
