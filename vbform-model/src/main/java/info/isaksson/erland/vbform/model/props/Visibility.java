package info.isaksson.erland.vbform.model.props;

public enum Visibility implements VbEnum {
    HIDDEN(0, "Hidden"),
    VISIBLE(-1, "Visible");

    private final int code;
    private final String label;

    Visibility(int code, String label) {
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
