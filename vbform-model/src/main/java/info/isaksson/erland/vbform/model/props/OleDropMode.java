package info.isaksson.erland.vbform.model.props;

public enum OleDropMode implements VbEnum {
    NONE(0, "None"),
    MANUAL(1, "Manual");

    private final int code;
    private final String label;

    OleDropMode(int code, String label) {
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
