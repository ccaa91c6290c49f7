package info.isaksson.erland.vbform.model.props;

/** Data control behaviour when moving before the first record. */
public enum BofAction implements VbEnum {
    MOVE_FIRST(0, "MoveFirst"),
    BOF(1, "Bof");

    private final int code;
    private final String label;

    BofAction(int code, String label) {
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
