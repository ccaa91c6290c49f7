package info.isaksson.erland.vbform.model.props;

public enum BackStyle implements VbEnum {
    TRANSPARENT(0, "Transparent"),
    OPAQUE(1, "Opaque");

    private final int code;
    private final String label;

    BackStyle(int code, String label) {
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
