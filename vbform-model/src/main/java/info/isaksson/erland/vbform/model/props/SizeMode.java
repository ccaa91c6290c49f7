package info.isaksson.erland.vbform.model.props;

/** How an OLE container sizes its object. */
public enum SizeMode implements VbEnum {
    CLIP(0, "Clip"),
    STRETCH(1, "Stretch"),
    AUTO_SIZE(2, "AutoSize"),
    ZOOM(3, "Zoom");

    private final int code;
    private final String label;

    SizeMode(int code, String label) {
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
