package info.isaksson.erland.vbform.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;
import java.util.UUID;

/**
 * An {@code Object = "{uuid}#version#flags"; "file.ocx"} line naming an ActiveX library
 * whose controls the form uses.
 */
@JsonPropertyOrder({"uuid", "version", "unknown1", "fileName"})
public final class ObjectReference {
    public final UUID uuid;
    public final String version;
    /** Third {@code #} field; its meaning is undocumented (usually 0). */
    public final String unknown1;
    public final String fileName;

    @JsonCreator
    public ObjectReference(
            @JsonProperty("uuid") UUID uuid,
            @JsonProperty("version") String version,
            @JsonProperty("unknown1") String unknown1,
            @JsonProperty("fileName") String fileName
    ) {
        if (uuid == null) throw new IllegalArgumentException("uuid must not be null");
        this.uuid = uuid;
        this.version = version == null ? "" : version;
        this.unknown1 = unknown1 == null ? "" : unknown1;
        this.fileName = fileName == null ? "" : fileName;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObjectReference)) return false;
        ObjectReference that = (ObjectReference) o;
        return uuid.equals(that.uuid) && version.equals(that.version)
                && unknown1.equals(that.unknown1) && fileName.equals(that.fileName);
    }

    @Override public int hashCode() {
        return Objects.hash(uuid, version, unknown1, fileName);
    }

    @Override public String toString() {
        return "ObjectReference{" + uuid + "#" + version + "#" + unknown1 + "; " + fileName + "}";
    }
}
