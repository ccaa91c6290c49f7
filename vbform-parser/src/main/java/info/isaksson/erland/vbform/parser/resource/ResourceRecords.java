package info.isaksson.erland.vbform.parser.resource;

import info.isaksson.erland.vbform.model.PropertyValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Decoder for the records of a VB6 companion resource file ({@code .frx}).
 *
 * <p>The file has no directory or global header. Every record frames itself, and the framing has to be
 * guessed from the first bytes at the referenced offset. The probes run in this order:</p>
 * <ol>
 *   <li>{@code "lt\0\0"} at offset+4: 12-byte image header ({@link ResourceRecord.Framing#BLOB})</li>
 *   <li>{@code 0xFF} marker: u16 length ({@link ResourceRecord.Framing#WORD_SIZED})</li>
 *   <li>{@code 03 00} or {@code 07 00} at offset+2: list of strings ({@link ResourceRecord.Framing#LIST})</li>
 *   <li>a zero among the first four bytes: u32 length ({@link ResourceRecord.Framing#DWORD_SIZED})</li>
 *   <li>otherwise: one length byte ({@link ResourceRecord.Framing#BYTE_SIZED})</li>
 * </ol>
 * <p>The image probe must run before the u32 probe: a valid image header always has a zero among its
 * first four bytes.</p>
 */
public final class ResourceRecords {

    private static final Logger LOG = LoggerFactory.getLogger(ResourceRecords.class);

    private ResourceRecords() {}

    /** Payload of the record at {@code offset}. */
    public static byte[] resolve(byte[] buffer, int offset) throws CorruptedResourceException, ResourceOffsetOutOfBoundsException {
        return read(buffer, offset).payload();
    }

    /** Decodes the record starting at {@code offset}. */
    public static ResourceRecord read(byte[] buffer, int offset) throws CorruptedResourceException, ResourceOffsetOutOfBoundsException {
        if (buffer == null) throw new IllegalArgumentException("buffer must not be null");
        final int len = buffer.length;
        if (offset < 0 || offset >= len) {
            throw new ResourceOffsetOutOfBoundsException(offset, len);
        }
        ByteBuffer bb = ByteBuffer.wrap(buffer).order(ByteOrder.LITTLE_ENDIAN);

        ResourceRecord record;
        if ((long) offset + 12 <= len && hasBlobMagic(buffer, offset)) {
            record = readBlob(buffer, bb, offset);
        } else if ((buffer[offset] & 0xFF) == 0xFF && (long) offset + 3 <= len) {
            long size = bb.getShort(offset + 1) & 0xFFFF;
            // The IDE saves short single strings one byte short.
            if (offset + 3 + size > len) size -= 1;
            record = slice(buffer, offset, ResourceRecord.Framing.WORD_SIZED, 3, size);
        } else if ((long) offset + 4 <= len && hasListMagic(buffer, offset + 2)) {
            int end = walkList(buffer, bb, offset);
            record = new ResourceRecord(offset, ResourceRecord.Framing.LIST, end - offset,
                    Arrays.copyOfRange(buffer, offset, end));
        } else if ((long) offset + 4 <= len && containsZero(buffer, offset, 4)) {
            long size = bb.getInt(offset) & 0xFFFFFFFFL;
            record = slice(buffer, offset, ResourceRecord.Framing.DWORD_SIZED, 4, size);
        } else {
            long size = buffer[offset] & 0xFF;
            // Same off-by-one as the 0xFF records.
            if (offset + 1 + size > len) size = Math.max(0, size - 1);
            record = slice(buffer, offset, ResourceRecord.Framing.BYTE_SIZED, 1, size);
        }

        if (LOG.isDebugEnabled()) {
            LOG.debug("Resource record at {}: {} ({} bytes)", offset, record.framing, record.totalSize);
        }
        return record;
    }

    /**
     * Reads every record of a companion file from the start, back to back.
     *
     * @throws CorruptedResourceException at the first record that cannot be framed
     */
    public static List<ResourceRecord> scan(byte[] buffer) throws CorruptedResourceException, ResourceOffsetOutOfBoundsException {
        if (buffer == null) throw new IllegalArgumentException("buffer must not be null");
        List<ResourceRecord> out = new ArrayList<>();
        int offset = 0;
        while (offset < buffer.length) {
            ResourceRecord r = read(buffer, offset);
            out.add(r);
            offset += r.totalSize;
        }
        return out;
    }

    /**
     * Splits a {@link ResourceRecord.Framing#LIST} record (as returned by {@link #resolve}) into its
     * strings, decoded with the VB6 code page.
     */
    public static List<String> listItems(byte[] record) throws CorruptedResourceException {
        if (record == null) throw new IllegalArgumentException("record must not be null");
        if (record.length < 4 || !hasListMagic(record, 2)) {
            throw new CorruptedResourceException(0, "Not a list record");
        }
        ByteBuffer bb = ByteBuffer.wrap(record).order(ByteOrder.LITTLE_ENDIAN);
        int count = bb.getShort(0) & 0xFFFF;
        List<String> items = new ArrayList<>(count);
        int pos = 4;
        for (int i = 0; i < count; i++) {
            if (pos + 2 > record.length) {
                throw new CorruptedResourceException(0, "Item " + i + " header out of bounds");
            }
            int size = bb.getShort(pos) & 0xFFFF;
            pos += 2;
            if (pos + size > record.length) {
                throw new CorruptedResourceException(0, "Item " + i + " data out of bounds");
            }
            items.add(new String(record, pos, size, PropertyValue.CODE_PAGE));
            pos += size;
        }
        return List.copyOf(items);
    }

    /** Whether {@code bytes} looks like a list record, without validating its items. */
    public static boolean isListRecord(byte[] bytes) {
        return bytes != null && bytes.length >= 4 && hasListMagic(bytes, 2);
    }

    private static ResourceRecord readBlob(byte[] buffer, ByteBuffer bb, int offset) throws CorruptedResourceException {
        long size1 = bb.getInt(offset) & 0xFFFFFFFFL;
        long size2 = bb.getInt(offset + 8) & 0xFFFFFFFFL;
        if (size1 == 8 && size2 == 0) {
            // An image that was added and then cleared in the IDE.
            return new ResourceRecord(offset, ResourceRecord.Framing.EMPTY, 12, new byte[0]);
        }
        if (size2 != size1 - 8) {
            throw new CorruptedResourceException(offset,
                    "Payload size " + size2 + " does not match record size " + size1 + " minus 8");
        }
        return slice(buffer, offset, ResourceRecord.Framing.BLOB, 12, size2);
    }

    private static int walkList(byte[] buffer, ByteBuffer bb, int offset) throws CorruptedResourceException {
        int count = bb.getShort(offset) & 0xFFFF;
        long pos = offset + 4L;
        for (int i = 0; i < count; i++) {
            if (pos + 2 > buffer.length) {
                throw new CorruptedResourceException(offset, "Item header out of bounds");
            }
            int size = bb.getShort((int) pos) & 0xFFFF;
            pos += 2 + size;
            if (pos > buffer.length) {
                throw new CorruptedResourceException(offset, "Item data out of bounds");
            }
        }
        return (int) pos;
    }

    private static ResourceRecord slice(byte[] buffer, int offset, ResourceRecord.Framing framing, int headerSize, long payloadSize)
            throws CorruptedResourceException {
        long start = (long) offset + headerSize;
        long end = start + payloadSize;
        if (end > buffer.length) {
            throw new CorruptedResourceException(offset,
                    framing + " payload of " + payloadSize + " bytes ends at " + end
                            + ", past the end of the file (" + buffer.length + " bytes)");
        }
        return new ResourceRecord(offset, framing, (int) (end - offset),
                Arrays.copyOfRange(buffer, (int) start, (int) end));
    }

    private static boolean hasBlobMagic(byte[] b, int offset) {
        return b[offset + 4] == 'l' && b[offset + 5] == 't' && b[offset + 6] == 0 && b[offset + 7] == 0;
    }

    private static boolean hasListMagic(byte[] b, int at) {
        return (b[at] == 0x03 || b[at] == 0x07) && b[at + 1] == 0x00;
    }

    private static boolean containsZero(byte[] b, int offset, int count) {
        for (int i = offset; i < offset + count; i++) {
            if (b[i] == 0) return true;
        }
        return false;
    }
}
