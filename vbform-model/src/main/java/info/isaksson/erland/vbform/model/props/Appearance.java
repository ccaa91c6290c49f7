package info.isaksson.erland.vbform.model.props;

/** Flat or 3D drawing of a control. */
public enum Appearance implements VbEnum {
    FLAT(0, "Flat"),
    THREE_D(1, "ThreeD");

    private final int code;
    private final String label;

    Appearance(int code, String label) {
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
