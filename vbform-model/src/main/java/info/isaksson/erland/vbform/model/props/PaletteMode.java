package info.isaksson.erland.vbform.model.props;

public enum PaletteMode implements VbEnum {
    HALF_TONE(0, "HalfTone"),
    USE_Z_ORDER(1, "UseZOrder"),
    CUSTOM(2, "Custom");

    private final int code;
    private final String label;

    PaletteMode(int code, String label) {
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
