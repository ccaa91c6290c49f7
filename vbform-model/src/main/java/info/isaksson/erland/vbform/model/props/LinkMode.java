package info.isaksson.erland.vbform.model.props;

/** DDE link mode of a control. */
public enum LinkMode implements VbEnum {
    NONE(0, "None"),
    AUTOMATIC(1, "Automatic"),
    MANUAL(2, "Manual"),
    NOTIFY(3, "Notify");

    private final int code;
    private final String label;

    LinkMode(int code, String label) {
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
