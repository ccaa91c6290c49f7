package info.isaksson.erland.vbform.model.props;

/** Coordinate unit of a container. */
public enum ScaleMode implements VbEnum {
    USER(0, "User"),
    TWIP(1, "Twip"),
    POINT(2, "Point"),
    PIXEL(3, "Pixel"),
    CHARACTER(4, "Character"),
    INCHES(5, "Inches"),
    MILLIMETER(6, "Millimeter"),
    CENTIMETER(7, "Centimeter"),
    HI_METRIC(8, "HiMetric"),
    CONTAINER_POSITION(9, "ContainerPosition"),
    CONTAINER_SIZE(10, "ContainerSize");

    private final int code;
    private final String label;

    ScaleMode(int code, String label) {
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
