package info.isaksson.erland.vbform.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * The {@code Attribute VB_*} lines that follow the control tree.
 *
 * <p>Keys other than the five well-known ones are kept verbatim in {@link #extensionKeys}.</p>
 */
@JsonPropertyOrder({"name", "globalNameSpace", "creatable", "predeclaredId", "exposed", "extensionKeys"})
public final class FileAttributes {
    public final String name;
    public final boolean globalNameSpace;
    public final boolean creatable;
    public final boolean predeclaredId;
    public final boolean exposed;
    public final Map<String, String> extensionKeys;

    @JsonCreator
    public FileAttributes(
            @JsonProperty("name") String name,
            @JsonProperty("globalNameSpace") boolean globalNameSpace,
            @JsonProperty("creatable") boolean creatable,
            @JsonProperty("predeclaredId") boolean predeclaredId,
            @JsonProperty("exposed") boolean exposed,
            @JsonProperty("extensionKeys") Map<String, String> extensionKeys
    ) {
        this.name = name == null ? "" : name;
        this.globalNameSpace = globalNameSpace;
        this.creatable = creatable;
        this.predeclaredId = predeclaredId;
        this.exposed = exposed;
        this.extensionKeys = extensionKeys == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(extensionKeys));
    }

    /** Attributes the IDE writes for a form that declares none explicitly. */
    public static FileAttributes defaults(String name) {
        return new FileAttributes(name, false, false, true, false, Map.of());
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileAttributes)) return false;
        FileAttributes that = (FileAttributes) o;
        return globalNameSpace == that.globalNameSpace && creatable == that.creatable
                && predeclaredId == that.predeclaredId && exposed == that.exposed
                && name.equals(that.name) && extensionKeys.equals(that.extensionKeys);
    }

    @Override public int hashCode() {
        return Objects.hash(name, globalNameSpace, creatable, predeclaredId, exposed, extensionKeys);
    }
}
