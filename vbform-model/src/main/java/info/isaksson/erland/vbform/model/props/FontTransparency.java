package info.isaksson.erland.vbform.model.props;

public enum FontTransparency implements VbEnum {
    OPAQUE(0, "Opaque"),
    TRANSPARENT(-1, "Transparent");

    private final int code;
    private final String label;

    FontTransparency(int code, String label) {
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
