package info.isaksson.erland.vbform.parser.resource;

import java.io.IOException;

/** A resource record whose framing disagrees with the buffer it was read from. */
public class CorruptedResourceException extends IOException {
    private final int offset;
    private final String detail;

    public CorruptedResourceException(int offset, String detail) {
        super("Corrupted resource at offset " + offset + ": " + detail);
        this.offset = offset;
        this.detail = detail;
    }

    /** Offset of the record header that failed to decode. */
    public int getOffset() {
        return offset;
    }

    public String getDetail() {
        return detail;
    }
}
