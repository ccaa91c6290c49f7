package info.isaksson.erland.vbform.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** One control occurrence in the tree. */
@JsonPropertyOrder({"name", "tag", "index", "kind"})
public final class ControlNode {
    public final String name;
    public final String tag;
    public final int index;
    public final ControlKind kind;

    public ControlNode(String name, String tag, int index, ControlKind kind) {
        if (name == null) throw new IllegalArgumentException("name must not be null");
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        this.name = name;
        this.tag = tag == null ? "" : tag;
        this.index = index;
        this.kind = kind;
    }

    /** Same node under another name (used when {@code VB_Name} overrides the root name). */
    public ControlNode withName(String newName) {
        return new ControlNode(newName, tag, index, kind);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ControlNode)) return false;
        ControlNode that = (ControlNode) o;
        return index == that.index && name.equals(that.name) && tag.equals(that.tag) && kind.equals(that.kind);
    }

    @Override public int hashCode() {
        return Objects.hash(name, tag, index, kind);
    }

    @Override public String toString() {
        return "ControlNode{" + kind.type() + " " + name + (index != 0 ? "(" + index + ")" : "") + "}";
    }
}
