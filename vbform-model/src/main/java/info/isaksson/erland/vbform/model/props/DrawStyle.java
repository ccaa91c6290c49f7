package info.isaksson.erland.vbform.model.props;

/** Line style. */
public enum DrawStyle implements VbEnum {
    SOLID(0, "Solid"),
    DASH(1, "Dash"),
    DOT(2, "Dot"),
    DASH_DOT(3, "DashDot"),
    DASH_DOT_DOT(4, "DashDotDot"),
    TRANSPARENT(5, "Transparent"),
    INSIDE_SOLID(6, "InsideSolid");

    private final int code;
    private final String label;

    DrawStyle(int code, String label) {
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
