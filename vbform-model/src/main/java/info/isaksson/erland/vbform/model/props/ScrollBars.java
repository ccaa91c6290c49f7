package info.isaksson.erland.vbform.model.props;

/** Scroll bars shown by a text box or form. */
public enum ScrollBars implements VbEnum {
    NONE(0, "None"),
    HORIZONTAL(1, "Horizontal"),
    VERTICAL(2, "Vertical"),
    BOTH(3, "Both");

    private final int code;
    private final String label;

    ScrollBars(int code, String label) {
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
