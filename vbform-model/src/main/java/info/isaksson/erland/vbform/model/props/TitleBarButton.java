package info.isaksson.erland.vbform.model.props;

/** The {@code ControlBox}, {@code MaxButton} and {@code MinButton} properties of a form. */
public enum TitleBarButton implements VbEnum {
    EXCLUDED(0, "Excluded"),
    INCLUDED(-1, "Included");

    private final int code;
    private final String label;

    TitleBarButton(int code, String label) {
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
