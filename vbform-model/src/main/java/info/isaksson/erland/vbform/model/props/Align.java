package info.isaksson.erland.vbform.model.props;

/** Docking of a picture box inside its form. */
public enum Align implements VbEnum {
    NONE(0, "None"),
    TOP(1, "Top"),
    BOTTOM(2, "Bottom"),
    LEFT(3, "Left"),
    RIGHT(4, "Right");

    private final int code;
    private final String label;

    Align(int code, String label) {
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
