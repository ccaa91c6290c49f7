package info.isaksson.erland.vbform.model.props;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Lookup helpers for {@link VbEnum} constants. */
public final class VbEnums {

    private VbEnums() {}

    public static <E extends Enum<E> & VbEnum> Optional<E> fromCode(Class<E> type, int code) {
        for (E e : type.getEnumConstants()) {
            if (e.code() == code) return Optional.of(e);
        }
        return Optional.empty();
    }

    /**
     * Lists every valid value the way the VB6 error messages do:
     * {@code "0 (Flat), or 1 (ThreeD)"}.
     */
    public static <E extends Enum<E> & VbEnum> String describeValues(Class<E> type) {
        List<String> parts = new ArrayList<>();
        for (E e : type.getEnumConstants()) {
            parts.add(e.code() + " (" + e.label() + ")");
        }
        return joinWithOr(parts);
    }

    static String joinWithOr(List<String> parts) {
        if (parts.size() == 1) return parts.get(0);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) sb.append(i == parts.size() - 1 ? ", or " : ", ");
            sb.append(parts.get(i));
        }
        return sb.toString();
    }
}
