package info.isaksson.erland.vbform.model.props;

/** Cursor shown over a control. */
public enum MousePointer implements VbEnum {
    DEFAULT(0, "Default"),
    ARROW(1, "Arrow"),
    CROSS(2, "Cross"),
    I_BEAM(3, "IBeam"),
    ICON(4, "Icon"),
    SIZE(5, "Size"),
    SIZE_NESW(6, "SizeNESW"),
    SIZE_NS(7, "SizeNS"),
    SIZE_NWSE(8, "SizeNWSE"),
    SIZE_WE(9, "SizeWE"),
    UP_ARROW(10, "UpArrow"),
    HOURGLASS(11, "Hourglass"),
    NO_DROP(12, "NoDrop"),
    ARROW_HOURGLASS(13, "ArrowHourglass"),
    ARROW_QUESTION(14, "ArrowQuestion"),
    SIZE_ALL(15, "SizeAll"),
    CUSTOM(99, "Custom");

    private final int code;
    private final String label;

    MousePointer(int code, String label) {
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
