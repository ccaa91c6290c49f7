package info.isaksson.erland.vbform.model.props;

/** Raster operation used by graphics methods. */
public enum DrawMode implements VbEnum {
    BLACKNESS(1, "Blackness"),
    NOT_MERGE_PEN(2, "NotMergePen"),
    MASK_NOT_PEN(3, "MaskNotPen"),
    NOT_COPY_PEN(4, "NotCopyPen"),
    MASK_PEN_NOT(5, "MaskPenNot"),
    INVERT(6, "Invert"),
    XOR_PEN(7, "XorPen"),
    NOT_MASK_PEN(8, "NotMaskPen"),
    MASK_PEN(9, "MaskPen"),
    NOT_XOR_PEN(10, "NotXorPen"),
    NOP(11, "Nop"),
    MERGE_NOT_PEN(12, "MergeNotPen"),
    COPY_PEN(13, "CopyPen"),
    MERGE_PEN_NOT(14, "MergePenNot"),
    MERGE_PEN(15, "MergePen"),
    WHITENESS(16, "Whiteness");

    private final int code;
    private final String label;

    DrawMode(int code, String label) {
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
