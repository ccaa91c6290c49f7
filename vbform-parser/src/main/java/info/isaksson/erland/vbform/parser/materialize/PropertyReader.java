package info.isaksson.erland.vbform.parser.materialize;

import info.isaksson.erland.vbform.model.Color;
import info.isaksson.erland.vbform.model.Properties;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.props.StartUpPosition;
import info.isaksson.erland.vbform.model.props.TextCodedEnum;
import info.isaksson.erland.vbform.model.props.VbEnum;
import info.isaksson.erland.vbform.model.props.VbEnums;
import info.isaksson.erland.vbform.parser.FormErrorKind;
import info.isaksson.erland.vbform.parser.resource.CorruptedResourceException;
import info.isaksson.erland.vbform.parser.resource.ResourceRecords;

import java.util.List;
import java.util.Optional;

/**
 * Typed access to the raw properties of one control. Every accessor takes the value to keep when
 * the property is absent, so callers can start from IDE defaults and overwrite what the file sets.
 */
public final class PropertyReader {

    private final Properties properties;

    public PropertyReader(Properties properties) {
        if (properties == null) throw new IllegalArgumentException("properties must not be null");
        this.properties = properties;
    }

    public Properties properties() {
        return properties;
    }

    public String string(String key, String fallback) {
        PropertyValue v = properties.get(key);
        return v == null ? fallback : v.asText();
    }

    /** Signed 32-bit decimal integer. */
    public int integer(String key, int fallback) throws PropertyDecodeException {
        PropertyValue v = properties.get(key);
        if (v == null) return fallback;
        return parseInt(key, v.asText());
    }

    /** VB6 boolean: {@code 0} is false, {@code 1} and {@code -1} are true. */
    public boolean bool(String key, boolean fallback) throws PropertyDecodeException {
        PropertyValue v = properties.get(key);
        if (v == null) return fallback;
        String text = v.asText().trim();
        switch (text) {
            case "0":
                return false;
            case "1":
            case "-1":
                return true;
            default:
                throw invalid(key, text, "0 (False), 1 (True), or -1 (True)");
        }
    }

    public Color color(String key, Color fallback) throws PropertyDecodeException {
        PropertyValue v = properties.get(key);
        if (v == null) return fallback;
        String text = v.asText().trim();
        try {
            return Color.parse(text);
        } catch (IllegalArgumentException e) {
            throw new PropertyDecodeException(FormErrorKind.INVALID_PROPERTY_VALUE, key,
                    "The `" + key + "` value is invalid: '" + text + "'. " + e.getMessage(), e);
        }
    }

    /** Picture-like properties: the resolved companion bytes, or the literal text if none was referenced. */
    public PropertyValue binary(String key, PropertyValue fallback) {
        PropertyValue v = properties.get(key);
        return v == null ? fallback : v;
    }

    /**
     * List contents. A companion list record yields its items; a literal value is a single item.
     */
    public List<String> list(String key, List<String> fallback) throws PropertyDecodeException {
        PropertyValue v = properties.get(key);
        if (v == null) return fallback;
        if (!v.isResource()) return List.of(v.asText());
        byte[] bytes = v.asBytes();
        if (!ResourceRecords.isListRecord(bytes)) {
            throw new PropertyDecodeException(FormErrorKind.INVALID_PROPERTY_VALUE, key,
                    "The `" + key + "` value is not a list record (" + bytes.length + " bytes).");
        }
        try {
            return ResourceRecords.listItems(bytes);
        } catch (CorruptedResourceException e) {
            throw new PropertyDecodeException(FormErrorKind.CORRUPTED_RESOURCE, key, e.getMessage(), e);
        }
    }

    /** First character of the value, or {@code null} when the value is empty. */
    public String character(String key, String fallback) {
        PropertyValue v = properties.get(key);
        if (v == null) return fallback;
        String text = v.asText();
        if (text.isEmpty()) return null;
        return text.substring(0, Character.charCount(text.codePointAt(0)));
    }

    public <E extends Enum<E> & VbEnum> E enumValue(String key, Class<E> type, E fallback) throws PropertyDecodeException {
        PropertyValue v = properties.get(key);
        if (v == null) return fallback;
        String text = v.asText().trim();
        Optional<E> found = isInteger(text)
                ? VbEnums.fromCode(type, Integer.parseInt(text))
                : Optional.empty();
        if (found.isEmpty()) throw invalid(key, text, VbEnums.describeValues(type));
        return found.get();
    }

    public <E extends Enum<E> & TextCodedEnum> E textEnum(String key, Class<E> type, E fallback) throws PropertyDecodeException {
        PropertyValue v = properties.get(key);
        if (v == null) return fallback;
        String text = v.asText();
        Optional<E> found = TextCodedEnum.fromText(type, text);
        if (found.isEmpty()) throw invalid(key, text, TextCodedEnum.describeValues(type));
        return found.get();
    }

    /**
     * Reads {@code StartUpPosition}; the manual placement takes its geometry from the
     * {@code Client*} properties, which default to 0 when missing.
     */
    public StartUpPosition startUpPosition(StartUpPosition fallback) throws PropertyDecodeException {
        StartUpPosition.Kind kind = enumValue("StartUpPosition", StartUpPosition.Kind.class, null);
        if (kind == null) return fallback;
        if (kind == StartUpPosition.Kind.MANUAL) {
            return StartUpPosition.manual(
                    integer("ClientLeft", 0),
                    integer("ClientTop", 0),
                    integer("ClientWidth", 0),
                    integer("ClientHeight", 0));
        }
        return StartUpPosition.of(kind);
    }

    private static int parseInt(String key, String raw) throws PropertyDecodeException {
        String text = raw.trim();
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new PropertyDecodeException(FormErrorKind.PROPERTY_VALUE_UNPARSABLE, key,
                    "The `" + key + "` value is not a 32-bit integer: '" + text + "'.", e);
        }
    }

    /** Optional sign followed by up to nine digits, so the value always fits an {@code int}. */
    private static boolean isInteger(String text) {
        int start = text.startsWith("-") ? 1 : 0;
        int digits = text.length() - start;
        if (digits < 1 || digits > 9) return false;
        for (int i = start; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) return false;
        }
        return true;
    }

    private static PropertyDecodeException invalid(String key, String text, String validValues) {
        return new PropertyDecodeException(FormErrorKind.INVALID_PROPERTY_VALUE, key,
                "The `" + key + "` value is invalid: '" + text + "'. Only " + validValues + " are valid values.");
    }
}
