package info.isaksson.erland.vbform.parser;

import info.isaksson.erland.vbform.model.PropertyGroup;
import info.isaksson.erland.vbform.model.PropertyGroupEntry;
import info.isaksson.erland.vbform.parser.resource.ResourceResolver;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class PropertyGroupParserTest {

    private static final ResourceResolver NO_RESOURCES = (file, offset) -> {
        throw new AssertionError("unexpected resource lookup " + file + ":" + offset);
    };

    private static PropertyGroup parse(String text, ResourceResolver resolver) throws FormParseException {
        FormSource source = new FormSource("Test.frm", text);
        FormSource.Line begin = source.nextLine();
        return new PropertyGroupParser(resolver, 256).parse(source, begin);
    }

    @Test
    void parsesFontGroupWithGuid() throws Exception {
        PropertyGroup font = parse("""
                BeginProperty Font {0BE35203-8F91-11CE-9DE3-00AA004BB851}
                   Name            =   "MS Sans Serif"
                   Size            =   8.25
                   Charset         =   0   ' ANSI
                EndProperty
                """, NO_RESOURCES);

        assertEquals("Font", font.name);
        assertEquals(UUID.fromString("0BE35203-8F91-11CE-9DE3-00AA004BB851"), font.guid);
        assertEquals("MS Sans Serif", font.getText("Name"));
        assertEquals("8.25", font.getText("Size"));
        assertEquals("0", font.getText("Charset"));
        assertEquals(1, font.depth());
    }

    @Test
    void nestsThreeLevelsDeep() throws Exception {
        PropertyGroup a = parse("""
                BeginProperty A
                   X = 1
                   BeginProperty B
                      Y = 2
                      BeginProperty C
                         Z = 3
                      EndProperty
                   EndProperty
                   W = 4
                EndProperty
                """, NO_RESOURCES);

        assertEquals(3, a.depth());
        assertEquals("1", a.getText("X"));
        assertEquals("4", a.getText("W"));
        PropertyGroup b = a.getGroup("B");
        assertEquals("2", b.getText("Y"));
        PropertyGroup c = b.getGroup("C");
        assertEquals("3", c.getText("Z"));
        assertNull(c.guid);
        assertInstanceOf(PropertyGroupEntry.Nested.class, a.entries.get("B"));
    }

    @Test
    void resolvesResourceReferencesInsideGroup() throws Exception {
        byte[] frx = {0x02, 'h', 'i', 0x03, 'b', 'y', 'e'};
        PropertyGroup g = parse("""
                BeginProperty Panel1
                   Text = $"Form1.frx":0003
                EndProperty
                """, ResourceResolver.ofBuffer(frx));

        assertEquals("bye", g.getText("Text"));
    }

    @Test
    void malformedGuidIsRejected() {
        FormParseException e = assertThrows(FormParseException.class, () -> parse("""
                BeginProperty Font {0BE35203-8F91-11CE-9DE3}
                EndProperty
                """, NO_RESOURCES));

        assertEquals(FormErrorKind.INVALID_GUID, e.getKind());
        assertEquals(1, e.getLineNumber());
        assertEquals(19, e.getOffset());
    }

    @Test
    void endOfInputBeforeEndPropertyIsReported() {
        FormParseException e = assertThrows(FormParseException.class, () -> parse("""
                BeginProperty Font
                   Name = "Arial"
                   BeginProperty Inner
                   EndProperty
                """, NO_RESOURCES));

        assertEquals(FormErrorKind.NO_END_PROPERTY, e.getKind());
        assertEquals(FormErrorKind.Category.STRUCTURAL, e.getKind().category());
    }

    @Test
    void endPropertyMustEndItsLine() {
        FormParseException trailing = assertThrows(FormParseException.class, () -> parse("""
                BeginProperty Font
                EndProperty Font
                """, NO_RESOURCES));
        assertEquals(FormErrorKind.NO_LINE_ENDING_AFTER_END_PROPERTY, trailing.getKind());
        assertEquals(2, trailing.getLineNumber());

        FormParseException atEof = assertThrows(FormParseException.class,
                () -> parse("BeginProperty Font\r\nEndProperty", NO_RESOURCES));
        assertEquals(FormErrorKind.NO_LINE_ENDING_AFTER_END_PROPERTY, atEof.getKind());
    }

    @Test
    void controlEndInsideGroupMeansGroupIsUnclosed() {
        FormParseException e = assertThrows(FormParseException.class, () -> parse("""
                BeginProperty Font
                   Name = "Arial"
                End
                """, NO_RESOURCES));

        assertEquals(FormErrorKind.NO_END_PROPERTY, e.getKind());
        assertEquals(3, e.getLineNumber());
    }

    @Test
    void depthLimitApplies() {
        FormSource source = new FormSource("Deep.frm", """
                BeginProperty A
                BeginProperty B
                BeginProperty C
                EndProperty
                EndProperty
                EndProperty
                """);
        FormSource.Line begin = source.nextLine();

        FormParseException e = assertThrows(FormParseException.class,
                () -> new PropertyGroupParser(NO_RESOURCES, 2).parse(source, begin));
        assertEquals(FormErrorKind.NESTING_TOO_DEEP, e.getKind());
        assertEquals(3, e.getLineNumber());
    }
}
