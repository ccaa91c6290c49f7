package info.isaksson.erland.vbform.model.props;

/**
 * A property enumeration whose constants are stored in form files as integers.
 */
public interface VbEnum {

    /** The number written to the form file for this constant. */
    int code();

    /** Human-readable label used in error messages. */
    default String label() {
        return ((Enum<?>) this).name();
    }
}
