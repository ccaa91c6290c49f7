package info.isaksson.erland.vbform.model.props;

public enum FormBorderStyle implements VbEnum {
    NONE(0, "None"),
    FIXED_SINGLE(1, "FixedSingle"),
    SIZABLE(2, "Sizable"),
    FIXED_DIALOG(3, "FixedDialog"),
    FIXED_TOOL_WINDOW(4, "FixedToolWindow"),
    SIZABLE_TOOL_WINDOW(5, "SizableToolWindow");

    private final int code;
    private final String label;

    FormBorderStyle(int code, String label) {
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
