package info.isaksson.erland.vbform.model.props;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A property enumeration stored in form files as a literal string (e.g. a menu shortcut).
 */
public interface TextCodedEnum {

    /** The text written to the form file for this constant. */
    String text();

    static <E extends Enum<E> & TextCodedEnum> Optional<E> fromText(Class<E> type, String text) {
        for (E e : type.getEnumConstants()) {
            if (e.text().equals(text)) return Optional.of(e);
        }
        return Optional.empty();
    }

    /** {@code "'Access', 'dBase III', or 'Text'"}. */
    static <E extends Enum<E> & TextCodedEnum> String describeValues(Class<E> type) {
        List<String> parts = new ArrayList<>();
        for (E e : type.getEnumConstants()) {
            parts.add("'" + e.text() + "'");
        }
        return VbEnums.joinWithOr(parts);
    }
}
