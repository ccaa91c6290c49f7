package info.isaksson.erland.vbform.model.props;

public enum OleDragMode implements VbEnum {
    MANUAL(0, "Manual"),
    AUTOMATIC(1, "Automatic");

    private final int code;
    private final String label;

    OleDragMode(int code, String label) {
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
