package info.isaksson.erland.vbform.model.props;

public enum ShapeType implements VbEnum {
    RECTANGLE(0, "Rectangle"),
    SQUARE(1, "Square"),
    OVAL(2, "Oval"),
    CIRCLE(3, "Circle"),
    ROUNDED_RECTANGLE(4, "RoundedRectangle"),
    ROUND_SQUARE(5, "RoundSquare");

    private final int code;
    private final String label;

    ShapeType(int code, String label) {
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
