package info.isaksson.erland.vbform.model.props;

public enum WordWrap implements VbEnum {
    NON_WRAPPING(0, "NonWrapping"),
    WRAPPING(-1, "Wrapping");

    private final int code;
    private final String label;

    WordWrap(int code, String label) {
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
