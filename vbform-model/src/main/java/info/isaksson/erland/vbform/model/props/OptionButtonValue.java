package info.isaksson.erland.vbform.model.props;

public enum OptionButtonValue implements VbEnum {
    UN_SELECTED(0, "UnSelected"),
    SELECTED(1, "Selected");

    private final int code;
    private final String label;

    OptionButtonValue(int code, String label) {
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
