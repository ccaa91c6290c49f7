package info.isaksson.erland.vbform.model.props;

public enum AutoActivate implements VbEnum {
    MANUAL(0, "Manual"),
    GET_FOCUS(1, "GetFocus"),
    DOUBLE_CLICK(2, "DoubleClick"),
    AUTOMATIC(3, "Automatic");

    private final int code;
    private final String label;

    AutoActivate(int code, String label) {
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
