package info.isaksson.erland.vbform.model.props;

public enum OleTypeAllowed implements VbEnum {
    LINK(0, "Link"),
    EMBEDDED(1, "Embedded"),
    EITHER(2, "Either");

    private final int code;
    private final String label;

    OleTypeAllowed(int code, String label) {
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
