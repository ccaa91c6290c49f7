package info.isaksson.erland.vbform.model.props;

public enum CheckBoxValue implements VbEnum {
    UNCHECKED(0, "Unchecked"),
    CHECKED(1, "Checked"),
    GRAYED(2, "Grayed");

    private final int code;
    private final String label;

    CheckBoxValue(int code, String label) {
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
