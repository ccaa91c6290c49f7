package info.isaksson.erland.vbform.model.props;

public enum ComboBoxStyle implements VbEnum {
    DROP_DOWN_COMBO(0, "DropDownCombo"),
    SIMPLE_COMBO(1, "SimpleCombo"),
    DROP_DOWN_LIST(2, "DropDownList");

    private final int code;
    private final String label;

    ComboBoxStyle(int code, String label) {
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
