package info.isaksson.erland.vbform.model.props;

public enum Movability implements VbEnum {
    FIXED(0, "Fixed"),
    MOVEABLE(-1, "Moveable");

    private final int code;
    private final String label;

    Movability(int code, String label) {
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
