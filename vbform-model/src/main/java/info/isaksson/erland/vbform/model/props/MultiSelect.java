package info.isaksson.erland.vbform.model.props;

public enum MultiSelect implements VbEnum {
    NONE(0, "None"),
    SIMPLE(1, "Simple"),
    EXTENDED(2, "Extended");

    private final int code;
    private final String label;

    MultiSelect(int code, String label) {
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
