package info.isaksson.erland.vbform.model.props;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Initial placement of a form. Only {@link Kind#MANUAL} carries client geometry.
 */
@JsonPropertyOrder({"kind", "clientLeft", "clientTop", "clientWidth", "clientHeight"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StartUpPosition {

    public enum Kind implements VbEnum {
        MANUAL(0, "Manual"),
        CENTER_OWNER(1, "CenterOwner"),
        CENTER_SCREEN(2, "CenterScreen"),
        WINDOWS_DEFAULT(3, "WindowsDefault");

        private final int code;
        private final String label;

        Kind(int code, String label) {
            this.code = code;
            this.label = label;
        }

        @Override public int code() {
            return code;
        }

        @Override public String label() {
            return label;
        }
    }

    public static final StartUpPosition WINDOWS_DEFAULT = new StartUpPosition(Kind.WINDOWS_DEFAULT, null, null, null, null);

    public final Kind kind;
    public final Integer clientLeft;
    public final Integer clientTop;
    public final Integer clientWidth;
    public final Integer clientHeight;

    private StartUpPosition(Kind kind, Integer clientLeft, Integer clientTop, Integer clientWidth, Integer clientHeight) {
        this.kind = kind;
        this.clientLeft = clientLeft;
        this.clientTop = clientTop;
        this.clientWidth = clientWidth;
        this.clientHeight = clientHeight;
    }

    public static StartUpPosition manual(int clientLeft, int clientTop, int clientWidth, int clientHeight) {
        return new StartUpPosition(Kind.MANUAL, clientLeft, clientTop, clientWidth, clientHeight);
    }

    public static StartUpPosition of(Kind kind) {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        if (kind == Kind.MANUAL) throw new IllegalArgumentException("manual position needs client geometry");
        return new StartUpPosition(kind, null, null, null, null);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StartUpPosition)) return false;
        StartUpPosition that = (StartUpPosition) o;
        return kind == that.kind && Objects.equals(clientLeft, that.clientLeft)
                && Objects.equals(clientTop, that.clientTop)
                && Objects.equals(clientWidth, that.clientWidth)
                && Objects.equals(clientHeight, that.clientHeight);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, clientLeft, clientTop, clientWidth, clientHeight);
    }

    @Override public String toString() {
        return kind == Kind.MANUAL
                ? "Manual(" + clientLeft + "," + clientTop + "," + clientWidth + "," + clientHeight + ")"
                : kind.label();
    }
}
