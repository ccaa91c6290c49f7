package info.isaksson.erland.vbform.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/** One entry of a {@link PropertyGroup}: a scalar value or a nested group. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "entry")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PropertyGroupEntry.Scalar.class, name = "scalar"),
        @JsonSubTypes.Type(value = PropertyGroupEntry.Nested.class, name = "nested")
})
public abstract class PropertyGroupEntry {

    private PropertyGroupEntry() {}

    public static Scalar scalar(PropertyValue value) {
        return new Scalar(value);
    }

    public static Nested nested(PropertyGroup group) {
        return new Nested(group);
    }

    public static final class Scalar extends PropertyGroupEntry {
        @JsonProperty("value")
        public final PropertyValue value;

        private Scalar(PropertyValue value) {
            if (value == null) throw new IllegalArgumentException("value must not be null");
            this.value = value;
        }

        @Override public boolean equals(Object o) {
            return o instanceof Scalar && value.equals(((Scalar) o).value);
        }

        @Override public int hashCode() {
            return Objects.hash("scalar", value);
        }

        @Override public String toString() {
            return value.toString();
        }
    }

    public static final class Nested extends PropertyGroupEntry {
        @JsonProperty("group")
        public final PropertyGroup group;

        private Nested(PropertyGroup group) {
            if (group == null) throw new IllegalArgumentException("group must not be null");
            this.group = group;
        }

        @Override public boolean equals(Object o) {
            return o instanceof Nested && group.equals(((Nested) o).group);
        }

        @Override public int hashCode() {
            return Objects.hash("nested", group);
        }

        @Override public String toString() {
            return group.toString();
        }
    }
}
