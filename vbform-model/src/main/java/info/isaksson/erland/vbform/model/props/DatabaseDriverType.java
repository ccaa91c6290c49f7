package info.isaksson.erland.vbform.model.props;

/** The Data control {@code DefaultType} property. */
public enum DatabaseDriverType implements VbEnum {
    USE_ODBC(1, "UseOdbc"),
    USE_JET(2, "UseJet");

    private final int code;
    private final String label;

    DatabaseDriverType(int code, String label) {
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
