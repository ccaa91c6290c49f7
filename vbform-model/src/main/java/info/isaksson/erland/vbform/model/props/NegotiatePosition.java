package info.isaksson.erland.vbform.model.props;

/** Placement of a top-level menu when an OLE object is active. */
public enum NegotiatePosition implements VbEnum {
    NONE(0, "None"),
    LEFT(1, "Left"),
    MIDDLE(2, "Middle"),
    RIGHT(3, "Right");

    private final int code;
    private final String label;

    NegotiatePosition(int code, String label) {
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
