package info.isaksson.erland.vbform.parser.materialize;

import info.isaksson.erland.vbform.parser.FormErrorKind;

/**
 * A property that could not be turned into its typed value. Carries no source position; the tree
 * builder attaches the line the property was read from.
 */
public class PropertyDecodeException extends Exception {
    private final FormErrorKind kind;
    private final String propertyName;

    public PropertyDecodeException(FormErrorKind kind, String propertyName, String message) {
        this(kind, propertyName, message, null);
    }

    public PropertyDecodeException(FormErrorKind kind, String propertyName, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        this.kind = kind;
        this.propertyName = propertyName;
    }

    public FormErrorKind getKind() {
        return kind;
    }

    /** Name of the offending property, or {@code null} when the error concerns the whole control. */
    public String getPropertyName() {
        return propertyName;
    }
}
