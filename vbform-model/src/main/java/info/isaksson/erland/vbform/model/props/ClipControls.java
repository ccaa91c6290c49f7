package info.isaksson.erland.vbform.model.props;

public enum ClipControls implements VbEnum {
    UNBOUNDED(0, "Unbounded"),
    CLIPPED(1, "Clipped");

    private final int code;
    private final String label;

    ClipControls(int code, String label) {
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
