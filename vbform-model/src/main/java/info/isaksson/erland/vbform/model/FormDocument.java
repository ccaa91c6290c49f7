package info.isaksson.erland.vbform.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** A fully parsed form file: the root control plus file-level metadata. */
@JsonPropertyOrder({"version", "objects", "attributes", "root"})
public final class FormDocument {
    public final ControlNode root;
    public final FormVersion version;
    public final List<ObjectReference> objects;
    public final FileAttributes attributes;

    public FormDocument(ControlNode root, FormVersion version, List<ObjectReference> objects, FileAttributes attributes) {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        this.root = root;
        this.version = version == null ? FormVersion.DEFAULT : version;
        this.objects = objects == null ? List.of() : List.copyOf(objects);
        this.attributes = attributes == null ? FileAttributes.defaults(root.name) : attributes;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormDocument)) return false;
        FormDocument that = (FormDocument) o;
        return root.equals(that.root) && version.equals(that.version)
                && objects.equals(that.objects) && attributes.equals(that.attributes);
    }

    @Override public int hashCode() {
        return Objects.hash(root, version, objects, attributes);
    }
}
