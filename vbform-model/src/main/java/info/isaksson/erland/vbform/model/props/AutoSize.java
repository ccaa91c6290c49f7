package info.isaksson.erland.vbform.model.props;

/** Whether a label resizes to fit its caption. */
public enum AutoSize implements VbEnum {
    FIXED(0, "Fixed"),
    RESIZE(-1, "Resize");

    private final int code;
    private final String label;

    AutoSize(int code, String label) {
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
