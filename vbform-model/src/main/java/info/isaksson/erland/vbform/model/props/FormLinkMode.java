package info.isaksson.erland.vbform.model.props;

public enum FormLinkMode implements VbEnum {
    NONE(0, "None"),
    SOURCE(1, "Source");

    private final int code;
    private final String label;

    FormLinkMode(int code, String label) {
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
