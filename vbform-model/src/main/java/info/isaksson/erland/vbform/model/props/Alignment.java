package info.isaksson.erland.vbform.model.props;

/** Text alignment. */
public enum Alignment implements VbEnum {
    LEFT_JUSTIFY(0, "LeftJustify"),
    RIGHT_JUSTIFY(1, "RightJustify"),
    CENTER(2, "Center");

    private final int code;
    private final String label;

    Alignment(int code, String label) {
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
