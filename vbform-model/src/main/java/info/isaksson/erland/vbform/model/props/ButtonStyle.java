package info.isaksson.erland.vbform.model.props;

/** Standard or graphical rendering of buttons, check boxes and option buttons. */
public enum ButtonStyle implements VbEnum {
    STANDARD(0, "Standard"),
    GRAPHICAL(1, "Graphical");

    private final int code;
    private final String label;

    ButtonStyle(int code, String label) {
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
