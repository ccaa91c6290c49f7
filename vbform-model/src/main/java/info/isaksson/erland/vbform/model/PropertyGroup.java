package info.isaksson.erland.vbform.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A {@code BeginProperty ... EndProperty} block, e.g. a Font, possibly typed by a GUID.
 */
@JsonPropertyOrder({"name", "guid", "entries"})
public final class PropertyGroup {
    public final String name;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final UUID guid;
    public final Map<String, PropertyGroupEntry> entries;

    public PropertyGroup(String name, UUID guid, Map<String, PropertyGroupEntry> entries) {
        if (name == null) throw new IllegalArgumentException("name must not be null");
        this.name = name;
        this.guid = guid;
        this.entries = entries == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /** Scalar text of {@code key}, or {@code null} when absent or nested. */
    public String getText(String key) {
        PropertyGroupEntry e = entries.get(key);
        return e instanceof PropertyGroupEntry.Scalar ? ((PropertyGroupEntry.Scalar) e).value.asText() : null;
    }

    /** Nested group stored under {@code key}, or {@code null}. */
    public PropertyGroup getGroup(String key) {
        PropertyGroupEntry e = entries.get(key);
        return e instanceof PropertyGroupEntry.Nested ? ((PropertyGroupEntry.Nested) e).group : null;
    }

    /** Nesting depth: 1 for a group without nested groups. */
    public int depth() {
        int max = 0;
        for (PropertyGroupEntry e : entries.values()) {
            if (e instanceof PropertyGroupEntry.Nested) {
                max = Math.max(max, ((PropertyGroupEntry.Nested) e).group.depth());
            }
        }
        return max + 1;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyGroup)) return false;
        PropertyGroup that = (PropertyGroup) o;
        return name.equals(that.name) && Objects.equals(guid, that.guid) && entries.equals(that.entries);
    }

    @Override public int hashCode() {
        return Objects.hash(name, guid, entries);
    }

    @Override public String toString() {
        return "PropertyGroup{" + name + (guid == null ? "" : " {" + guid + "}") + " " + entries + "}";
    }
}
