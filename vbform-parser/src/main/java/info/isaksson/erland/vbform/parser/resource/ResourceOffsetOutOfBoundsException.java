package info.isaksson.erland.vbform.parser.resource;

import java.io.IOException;

/** A form references an offset at or past the end of its companion file. */
public class ResourceOffsetOutOfBoundsException extends IOException {
    private final int offset;
    private final int length;

    public ResourceOffsetOutOfBoundsException(int offset, int length) {
        super("Resource offset " + offset + " is outside the companion file (length " + length + ")");
        this.offset = offset;
        this.length = length;
    }

    public int getOffset() {
        return offset;
    }

    public int getLength() {
        return length;
    }
}
