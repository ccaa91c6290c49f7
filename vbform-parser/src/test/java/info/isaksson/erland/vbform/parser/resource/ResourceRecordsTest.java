package info.isaksson.erland.vbform.parser.resource;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ResourceRecordsTest {

    private static byte[] bytes(int... values) {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) out[i] = (byte) values[i];
        return out;
    }

    private static String ascii(byte[] b) {
        return new String(b, StandardCharsets.US_ASCII);
    }

    @Test
    void imageRecordReturnsPayloadAfterTwelveByteHeader() throws Exception {
        byte[] buf = bytes(0x10, 0, 0, 0, 'l', 't', 0, 0, 0x08, 0, 0, 0, 1, 2, 3, 4, 5, 6, 7, 8);

        ResourceRecord record = ResourceRecords.read(buf, 0);

        assertEquals(ResourceRecord.Framing.BLOB, record.framing);
        assertEquals(20, record.totalSize);
        assertArrayEquals(bytes(1, 2, 3, 4, 5, 6, 7, 8), record.payload());
    }

    @Test
    void clearedImageYieldsEmptyPayload() throws Exception {
        byte[] buf = bytes(0x08, 0, 0, 0, 'l', 't', 0, 0, 0, 0, 0, 0);

        ResourceRecord record = ResourceRecords.read(buf, 0);

        assertEquals(ResourceRecord.Framing.EMPTY, record.framing);
        assertEquals(0, record.payload().length);
    }

    @Test
    void imageRecordWithInconsistentSizesIsCorrupted() {
        byte[] buf = bytes(0x10, 0, 0, 0, 'l', 't', 0, 0, 0x04, 0, 0, 0, 1, 2, 3, 4, 5, 6, 7, 8);

        CorruptedResourceException e = assertThrows(CorruptedResourceException.class, () -> ResourceRecords.resolve(buf, 0));
        assertEquals(0, e.getOffset());
        assertTrue(e.getDetail().contains("does not match"), e.getDetail());
    }

    @Test
    void wordSizedRecordOneByteShortIsCorrected() throws Exception {
        byte[] buf = bytes(0xFF, 0x05, 0x00, 'H', 'e', 'l', 'l');

        assertEquals("Hell", ascii(ResourceRecords.resolve(buf, 0)));
    }

    @Test
    void wordSizedRecordWithExactLength() throws Exception {
        byte[] buf = bytes(0xFF, 0x03, 0x00, 'a', 'b', 'c', 0x7F);

        ResourceRecord record = ResourceRecords.read(buf, 0);
        assertEquals(ResourceRecord.Framing.WORD_SIZED, record.framing);
        assertEquals("abc", ascii(record.payload()));
        assertEquals(6, record.totalSize);
    }

    @Test
    void listRecordKeepsWholeSpanAndSplitsIntoItems() throws Exception {
        byte[] buf = bytes(0x02, 0x00, 0x03, 0x00, 0x02, 0x00, 'a', 'b', 0x01, 0x00, 'c', 0x55);

        ResourceRecord record = ResourceRecords.read(buf, 0);

        assertEquals(ResourceRecord.Framing.LIST, record.framing);
        assertEquals(11, record.totalSize);
        assertTrue(ResourceRecords.isListRecord(record.payload()));
        assertEquals(List.of("ab", "c"), ResourceRecords.listItems(record.payload()));
    }

    @Test
    void listRecordWithItemPastEndIsCorrupted() {
        byte[] buf = bytes(0x02, 0x00, 0x07, 0x00, 0x02, 0x00, 'a', 'b', 0x09, 0x00, 'c');

        CorruptedResourceException e = assertThrows(CorruptedResourceException.class, () -> ResourceRecords.resolve(buf, 0));
        assertEquals("Item data out of bounds", e.getDetail());
    }

    @Test
    void dwordSizedRecordWhenHeaderContainsZero() throws Exception {
        byte[] buf = bytes(0x03, 0x00, 0x00, 0x00, 'x', 'y', 'z');

        ResourceRecord record = ResourceRecords.read(buf, 0);
        assertEquals(ResourceRecord.Framing.DWORD_SIZED, record.framing);
        assertEquals("xyz", ascii(record.payload()));
    }

    @Test
    void dwordSizedRecordPastEndIsCorrupted() {
        byte[] buf = bytes(0x10, 0x00, 0x00, 0x00, 'a');

        assertThrows(CorruptedResourceException.class, () -> ResourceRecords.resolve(buf, 0));
    }

    @Test
    void byteSizedRecordAsFallback() throws Exception {
        byte[] buf = bytes(0x03, 'a', 'b', 'c');

        ResourceRecord record = ResourceRecords.read(buf, 0);
        assertEquals(ResourceRecord.Framing.BYTE_SIZED, record.framing);
        assertEquals("abc", ascii(record.payload()));
    }

    @Test
    void byteSizedRecordOneByteShortIsCorrected() throws Exception {
        assertEquals("abc", ascii(ResourceRecords.resolve(bytes(0x04, 'a', 'b', 'c'), 0)));
    }

    @Test
    void offsetAtEndOfBufferIsOutOfBounds() {
        byte[] buf = bytes(0x01, 'a');

        ResourceOffsetOutOfBoundsException e =
                assertThrows(ResourceOffsetOutOfBoundsException.class, () -> ResourceRecords.resolve(buf, 2));
        assertEquals(2, e.getOffset());
        assertEquals(2, e.getLength());
    }

    @Test
    void recordsAtNonZeroOffsetsAndSequentialScan() throws Exception {
        byte[] buf = bytes(
                0x02, 'h', 'i',
                0xFF, 0x02, 0x00, 'o', 'k',
                0x08, 0, 0, 0, 'l', 't', 0, 0, 0, 0, 0, 0);

        assertEquals("ok", ascii(ResourceRecords.resolve(buf, 3)));

        List<ResourceRecord> records = ResourceRecords.scan(buf);
        assertEquals(3, records.size());
        assertEquals(0, records.get(0).offset);
        assertEquals(3, records.get(1).offset);
        assertEquals(8, records.get(2).offset);
        assertEquals(ResourceRecord.Framing.EMPTY, records.get(2).framing);
    }

    @Test
    void bufferResolverIgnoresFileName() throws Exception {
        ResourceResolver resolver = ResourceResolver.ofBuffer(bytes(0x02, 'h', 'i'));

        assertEquals("hi", ascii(resolver.resolve("whatever.frx", 0)));
    }
}
