package info.isaksson.erland.vbform.model.props;

public enum ShowInTaskbar implements VbEnum {
    HIDE(0, "Hide"),
    SHOW(-1, "Show");

    private final int code;
    private final String label;

    ShowInTaskbar(int code, String label) {
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
