package info.isaksson.erland.vbform.model.props;

public enum UpdateOptions implements VbEnum {
    AUTOMATIC(0, "Automatic"),
    FROZEN(1, "Frozen"),
    MANUAL(2, "Manual");

    private final int code;
    private final String label;

    UpdateOptions(int code, String label) {
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
