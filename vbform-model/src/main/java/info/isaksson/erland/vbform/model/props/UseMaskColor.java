package info.isaksson.erland.vbform.model.props;

public enum UseMaskColor implements VbEnum {
    DO_NOT_USE_MASK_COLOR(0, "DoNotUseMaskColor"),
    USE_MASK_COLOR(-1, "UseMaskColor");

    private final int code;
    private final String label;

    UseMaskColor(int code, String label) {
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
