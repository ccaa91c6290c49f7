package info.isaksson.erland.vbform.model.props;

public enum ListBoxStyle implements VbEnum {
    STANDARD(0, "Standard"),
    CHECKBOX(1, "Checkbox");

    private final int code;
    private final String label;

    ListBoxStyle(int code, String label) {
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
