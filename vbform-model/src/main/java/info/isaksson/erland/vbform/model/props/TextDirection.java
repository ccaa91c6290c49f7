package info.isaksson.erland.vbform.model.props;

/** The {@code RightToLeft} property. */
public enum TextDirection implements VbEnum {
    LEFT_TO_RIGHT(0, "LeftToRight"),
    RIGHT_TO_LEFT(-1, "RightToLeft");

    private final int code;
    private final String label;

    TextDirection(int code, String label) {
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
