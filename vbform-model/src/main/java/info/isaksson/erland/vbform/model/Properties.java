package info.isaksson.erland.vbform.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Raw property map of one control or group: case-sensitive names to raw values.
 *
 * <p>Immutable. Build instances with {@link Builder}; a repeated key replaces the earlier value.</p>
 */
public final class Properties {

    private static final Properties EMPTY = new Properties(Map.of());

    private final Map<String, PropertyValue> values;

    private Properties(Map<String, PropertyValue> values) {
        this.values = values;
    }

    public static Properties empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public PropertyValue get(String key) {
        return values.get(key);
    }

    /** Text of the value for {@code key}, or {@code null} when absent. */
    public String getText(String key) {
        PropertyValue v = values.get(key);
        return v == null ? null : v.asText();
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @JsonValue
    public Map<String, PropertyValue> asMap() {
        return values;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Properties)) return false;
        return values.equals(((Properties) o).values);
    }

    @Override public int hashCode() {
        return values.hashCode();
    }

    @Override public String toString() {
        return "Properties" + values;
    }

    public static final class Builder {
        private final Map<String, PropertyValue> values = new LinkedHashMap<>();

        private Builder() {}

        /** Inserts or replaces. Returns the replaced value, if any. */
        public PropertyValue put(String key, PropertyValue value) {
            if (key == null) throw new IllegalArgumentException("key must not be null");
            if (value == null) throw new IllegalArgumentException("value must not be null");
            return values.put(key, value);
        }

        public PropertyValue putText(String key, String text) {
            return put(key, PropertyValue.text(text));
        }

        public Properties build() {
            if (values.isEmpty()) return EMPTY;
            return new Properties(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
