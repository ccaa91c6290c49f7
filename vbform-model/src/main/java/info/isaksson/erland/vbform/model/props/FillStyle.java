package info.isaksson.erland.vbform.model.props;

public enum FillStyle implements VbEnum {
    SOLID(0, "Solid"),
    TRANSPARENT(1, "Transparent"),
    HORIZONTAL_LINE(2, "HorizontalLine"),
    VERTICAL_LINE(3, "VerticalLine"),
    UPWARD_DIAGONAL(4, "UpwardDiagonal"),
    DOWNWARD_DIAGONAL(5, "DownwardDiagonal"),
    CROSS(6, "Cross"),
    DIAGONAL_CROSS(7, "DiagonalCross");

    private final int code;
    private final String label;

    FillStyle(int code, String label) {
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
