package info.isaksson.erland.vbform.model.props;

/** Data control behaviour when moving past the last record. */
public enum EofAction implements VbEnum {
    MOVE_LAST(0, "MoveLast"),
    EOF(1, "Eof"),
    ADD_NEW(2, "AddNew");

    private final int code;
    private final String label;

    EofAction(int code, String label) {
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
