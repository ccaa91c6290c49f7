package info.isaksson.erland.vbform.model.props;

/** Caption placement of check boxes and option buttons. */
public enum JustifyAlignment implements VbEnum {
    LEFT_JUSTIFY(0, "LeftJustify"),
    RIGHT_JUSTIFY(1, "RightJustify");

    private final int code;
    private final String label;

    JustifyAlignment(int code, String label) {
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
