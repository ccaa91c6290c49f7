package info.isaksson.erland.vbform.parser;

/**
 * What went wrong while parsing a form. Every kind is fatal: the parse stops at the first error.
 */
public enum FormErrorKind {
    UNTERMINATED_CONTROL_BLOCK(Category.STRUCTURAL, "Control block is missing its 'End'"),
    NO_END_PROPERTY(Category.STRUCTURAL, "Property group is missing its 'EndProperty'"),
    NO_LINE_ENDING_AFTER_END_PROPERTY(Category.STRUCTURAL, "'EndProperty' must be followed by a line ending"),
    MISSING_NAMESPACE_DOT(Category.STRUCTURAL, "Control type must be written as <namespace>.<kind>"),
    NO_CONTROL_NAME_AFTER_KIND(Category.STRUCTURAL, "Control type must be followed by a control name"),
    UNEXPECTED_CHILD_KIND(Category.STRUCTURAL, "Control cannot be nested here"),
    NESTING_TOO_DEEP(Category.STRUCTURAL, "Blocks are nested deeper than the configured limit"),
    INVALID_HEADER(Category.STRUCTURAL, "Malformed file header"),
    CORRUPTED_RESOURCE(Category.RESOURCE, "Resource record is corrupted"),
    RESOURCE_FILE_IO_ERROR(Category.RESOURCE, "Companion resource file could not be read"),
    RESOURCE_OFFSET_OUT_OF_BOUNDS(Category.RESOURCE, "Resource offset is outside the companion file"),
    INVALID_PROPERTY_VALUE(Category.PROPERTY_VALUE, "Invalid property value"),
    PROPERTY_VALUE_UNPARSABLE(Category.PROPERTY_VALUE, "Property value could not be parsed"),
    UNKNOWN_CONTROL_KIND(Category.PROPERTY_VALUE, "Unknown built-in control kind"),
    INVALID_GUID(Category.PROPERTY_VALUE, "Malformed GUID");

    public enum Category { STRUCTURAL, RESOURCE, PROPERTY_VALUE }

    private final Category category;
    private final String description;

    FormErrorKind(Category category, String description) {
        this.category = category;
        this.description = description;
    }

    public Category category() {
        return category;
    }

    public String description() {
        return description;
    }
}
