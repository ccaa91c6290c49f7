package info.isaksson.erland.vbform.model.props;

public enum DisplayType implements VbEnum {
    CONTENT(0, "Content"),
    ICON(1, "Icon");

    private final int code;
    private final String label;

    DisplayType(int code, String label) {
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
