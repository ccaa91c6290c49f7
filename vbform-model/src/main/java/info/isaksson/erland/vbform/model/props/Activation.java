package info.isaksson.erland.vbform.model.props;

/** The {@code Enabled} property. */
public enum Activation implements VbEnum {
    DISABLED(0, "Disabled"),
    ENABLED(-1, "Enabled");

    private final int code;
    private final String label;

    Activation(int code, String label) {
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
