package info.isaksson.erland.vbform.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** The {@code VERSION major.minor} header of a form file. */
@JsonPropertyOrder({"major", "minor"})
public final class FormVersion {

    /** Version written by the VB6 IDE, and assumed when the header is missing. */
    public static final FormVersion DEFAULT = new FormVersion(5, 0);

    public final int major;
    public final int minor;

    @JsonCreator
    public FormVersion(@JsonProperty("major") int major, @JsonProperty("minor") int minor) {
        this.major = major;
        this.minor = minor;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormVersion)) return false;
        FormVersion that = (FormVersion) o;
        return major == that.major && minor == that.minor;
    }

    @Override public int hashCode() {
        return Objects.hash(major, minor);
    }

    @Override public String toString() {
        return major + "." + (minor < 10 ? "0" + minor : String.valueOf(minor));
    }
}
