package info.isaksson.erland.vbform.model.props;

/** Border of most controls. */
public enum BorderStyle implements VbEnum {
    NONE(0, "None"),
    FIXED_SINGLE(1, "FixedSingle");

    private final int code;
    private final String label;

    BorderStyle(int code, String label) {
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
