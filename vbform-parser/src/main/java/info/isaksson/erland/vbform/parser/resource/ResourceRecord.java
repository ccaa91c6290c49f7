package info.isaksson.erland.vbform.parser.resource;

/**
 * One self-framing record of a companion resource file.
 */
public final class ResourceRecord {

    /** Header layouts, in the order they are probed. */
    public enum Framing {
        /** 12-byte header: u32 size, {@code "lt\0\0"}, u32 payload size. Used for images. */
        BLOB,
        /** A {@link #BLOB} header whose payload was removed in the IDE (size 8, payload 0). */
        EMPTY,
        /** {@code 0xFF} marker followed by a u16 length. */
        WORD_SIZED,
        /** u16 item count, {@code 03 00} or {@code 07 00}, then length-prefixed items. */
        LIST,
        /** u32 length. */
        DWORD_SIZED,
        /** Single length byte. */
        BYTE_SIZED
    }

    public final int offset;
    public final Framing framing;
    /** Bytes occupied by the record, header included. */
    public final int totalSize;
    private final byte[] payload;

    ResourceRecord(int offset, Framing framing, int totalSize, byte[] payload) {
        this.offset = offset;
        this.framing = framing;
        this.totalSize = totalSize;
        this.payload = payload;
    }

    /**
     * The record payload. For {@link Framing#LIST} this is the whole record, header included, so
     * that {@link ResourceRecords#listItems(byte[])} can re-walk it.
     */
    public byte[] payload() {
        return payload.clone();
    }

    @Override public String toString() {
        return "ResourceRecord{" + framing + " @" + offset + ", " + payload.length + " bytes}";
    }
}
