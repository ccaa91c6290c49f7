package info.isaksson.erland.vbform.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.nio.charset.Charset;
import java.util.Arrays;
import java.util.Objects;

/**
 * A raw property value: either text taken from the form file, or a payload resolved
 * from the companion resource file.
 */
@JsonPropertyOrder({"text", "resource"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PropertyValue {

    /** Legacy code page used by the VB6 IDE for form text and resource strings. */
    public static final Charset CODE_PAGE = Charset.forName("windows-1252");

    private final String text;
    private final byte[] resource;

    private PropertyValue(String text, byte[] resource) {
        this.text = text;
        this.resource = resource;
    }

    public static PropertyValue text(String text) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        return new PropertyValue(text, null);
    }

    public static PropertyValue resource(byte[] bytes) {
        if (bytes == null) throw new IllegalArgumentException("bytes must not be null");
        return new PropertyValue(null, bytes.clone());
    }

    @JsonIgnore
    public boolean isResource() {
        return resource != null;
    }

    /** The value as text; resource payloads are decoded with {@link #CODE_PAGE}. */
    public String asText() {
        return text != null ? text : new String(resource, CODE_PAGE);
    }

    /** The value as bytes; text is encoded with {@link #CODE_PAGE}. Always a fresh copy. */
    public byte[] asBytes() {
        return text != null ? text.getBytes(CODE_PAGE) : resource.clone();
    }

    @JsonProperty("text")
    String jsonText() {
        return text;
    }

    @JsonProperty("resource")
    byte[] jsonResource() {
        return resource;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyValue)) return false;
        PropertyValue that = (PropertyValue) o;
        return Objects.equals(text, that.text) && Arrays.equals(resource, that.resource);
    }

    @Override public int hashCode() {
        return 31 * Objects.hashCode(text) + Arrays.hashCode(resource);
    }

    @Override public String toString() {
        return isResource() ? "PropertyValue{resource[" + resource.length + "]}" : "PropertyValue{" + text + "}";
    }
}
