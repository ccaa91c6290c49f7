package info.isaksson.erland.vbform.model.props;

public enum TabStop implements VbEnum {
    PROGRAMMATIC_ONLY(0, "ProgrammaticOnly"),
    INCLUDED(-1, "Included");

    private final int code;
    private final String label;

    TabStop(int code, String label) {
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
