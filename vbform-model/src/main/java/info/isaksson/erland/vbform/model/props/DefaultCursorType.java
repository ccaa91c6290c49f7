package info.isaksson.erland.vbform.model.props;

public enum DefaultCursorType implements VbEnum {
    DEFAULT_CURSOR(0, "DefaultCursor"),
    ODBC_CURSOR(1, "OdbcCursor"),
    SERVER_SIDE_CURSOR(2, "ServerSideCursor");

    private final int code;
    private final String label;

    DefaultCursorType(int code, String label) {
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
