package info.isaksson.erland.vbform.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ColorTest {

    @Test
    void rgbBytesAreStoredBlueGreenRed() {
        Color c = Color.parse("&H00C0FF80&");

        assertEquals(Color.Kind.RGB, c.kind);
        assertEquals(0x80, c.red);
        assertEquals(0xFF, c.green);
        assertEquals(0xC0, c.blue);
        assertEquals("&H00C0FF80&", c.toVbString());
    }

    @Test
    void systemColorUsesLowByteAsIndex() {
        Color c = Color.parse("&H80000012&");

        assertEquals(Color.Kind.SYSTEM, c.kind);
        assertEquals(0x12, c.systemIndex);
        assertEquals(Color.BUTTON_TEXT, c);
        assertEquals("&H80000012&", c.toVbString());
    }

    @Test
    void trailingAmpersandAndCaseAreOptional() {
        assertEquals(Color.WHITE, Color.parse("&h00ffffff"));
        assertEquals(Color.SILVER, Color.parse("  &H00C0C0C0&  "));
    }

    @Test
    void rejectsUnknownKindAndMalformedLiterals() {
        assertThrows(IllegalArgumentException.class, () -> Color.parse("&H40000000&"));
        assertThrows(IllegalArgumentException.class, () -> Color.parse("&H00FFFF&"));
        assertThrows(IllegalArgumentException.class, () -> Color.parse("0x00FFFFFF"));
        assertThrows(IllegalArgumentException.class, () -> Color.parse("&H00GGFFFF&"));
    }
}
