package info.isaksson.erland.vbform.model.props;

public enum HasDeviceContext implements VbEnum {
    NO(0, "No"),
    YES(-1, "Yes");

    private final int code;
    private final String label;

    HasDeviceContext(int code, String label) {
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
