package info.isaksson.erland.vbform.model.props;

public enum MultiLine implements VbEnum {
    SINGLE_LINE(0, "SingleLine"),
    MULTI_LINE(-1, "MultiLine");

    private final int code;
    private final String label;

    MultiLine(int code, String label) {
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
