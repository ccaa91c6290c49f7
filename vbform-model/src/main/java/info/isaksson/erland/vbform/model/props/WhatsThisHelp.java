package info.isaksson.erland.vbform.model.props;

public enum WhatsThisHelp implements VbEnum {
    F1_HELP(0, "F1Help"),
    WHATS_THIS_HELP(-1, "WhatsThisHelp");

    private final int code;
    private final String label;

    WhatsThisHelp(int code, String label) {
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
