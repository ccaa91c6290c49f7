package info.isaksson.erland.vbform.parser.materialize;

import info.isaksson.erland.vbform.model.Color;
import info.isaksson.erland.vbform.model.Properties;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.props.Appearance;
import info.isaksson.erland.vbform.model.props.MenuShortcut;
import info.isaksson.erland.vbform.model.props.StartUpPosition;
import info.isaksson.erland.vbform.parser.FormErrorKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PropertyReaderTest {

    private static PropertyReader reader(String... keyValues) {
        Properties.Builder b = Properties.builder();
        for (int i = 0; i < keyValues.length; i += 2) b.putText(keyValues[i], keyValues[i + 1]);
        return new PropertyReader(b.build());
    }

    @Test
    void absentKeysKeepFallbacks() throws Exception {
        PropertyReader r = reader();
        assertEquals(42, r.integer("Height", 42));
        assertTrue(r.bool("Visible", true));
        assertEquals(Appearance.THREE_D, r.enumValue("Appearance", Appearance.class, Appearance.THREE_D));
        assertEquals(Color.BUTTON_FACE, r.color("BackColor", Color.BUTTON_FACE));
        assertNull(r.textEnum("Shortcut", MenuShortcut.class, null));
        assertEquals(List.of(), r.list("List", List.of()));
        assertSame(StartUpPosition.WINDOWS_DEFAULT, r.startUpPosition(StartUpPosition.WINDOWS_DEFAULT));
    }

    @Test
    void booleansAcceptZeroOneAndMinusOne() throws Exception {
        PropertyReader r = reader("A", "0", "B", "1", "C", "-1", "D", "2");
        assertFalse(r.bool("A", true));
        assertTrue(r.bool("B", false));
        assertTrue(r.bool("C", false));

        PropertyDecodeException e = assertThrows(PropertyDecodeException.class, () -> r.bool("D", false));
        assertEquals(FormErrorKind.INVALID_PROPERTY_VALUE, e.getKind());
        assertEquals("D", e.getPropertyName());
    }

    @Test
    void enumerationErrorListsEveryValidValue() {
        PropertyReader r = reader("Appearance", "2");

        PropertyDecodeException e = assertThrows(PropertyDecodeException.class,
                () -> r.enumValue("Appearance", Appearance.class, Appearance.THREE_D));

        assertEquals(FormErrorKind.INVALID_PROPERTY_VALUE, e.getKind());
        assertEquals("The `Appearance` value is invalid: '2'. Only 0 (Flat), or 1 (ThreeD) are valid values.", e.getMessage());
    }

    @Test
    void nonNumericEnumerationIsInvalidToo() {
        PropertyReader r = reader("Appearance", "Flat");

        PropertyDecodeException e = assertThrows(PropertyDecodeException.class,
                () -> r.enumValue("Appearance", Appearance.class, Appearance.THREE_D));
        assertEquals(FormErrorKind.INVALID_PROPERTY_VALUE, e.getKind());
    }

    @Test
    void integersAreSigned32Bit() throws Exception {
        PropertyReader r = reader("A", "-2147483648", "B", "2147483648", "C", "12px");
        assertEquals(Integer.MIN_VALUE, r.integer("A", 0));

        assertEquals(FormErrorKind.PROPERTY_VALUE_UNPARSABLE,
                assertThrows(PropertyDecodeException.class, () -> r.integer("B", 0)).getKind());
        assertEquals(FormErrorKind.PROPERTY_VALUE_UNPARSABLE,
                assertThrows(PropertyDecodeException.class, () -> r.integer("C", 0)).getKind());
    }

    @Test
    void colorsDecodeRgbAndSystemValues() throws Exception {
        PropertyReader r = reader("Fore", "&H00FF8000&", "Back", "&H8000000F&", "Bad", "&H40FFFFFF&");

        Color fore = r.color("Fore", null);
        assertEquals(Color.Kind.RGB, fore.kind);
        assertEquals(0x00, fore.red);
        assertEquals(0x80, fore.green);
        assertEquals(0xFF, fore.blue);
        assertEquals(Color.BUTTON_FACE, r.color("Back", null));

        PropertyDecodeException e = assertThrows(PropertyDecodeException.class, () -> r.color("Bad", null));
        assertEquals(FormErrorKind.INVALID_PROPERTY_VALUE, e.getKind());
        assertTrue(e.getMessage().startsWith("The `Bad` value is invalid: '&H40FFFFFF&'."), e.getMessage());
    }

    @Test
    void textCodedEnumsMatchExactText() throws Exception {
        PropertyReader r = reader("Shortcut", "^{F1}", "Other", "Ctrl+F1");
        assertEquals(MenuShortcut.CTRL_F1, r.textEnum("Shortcut", MenuShortcut.class, null));

        PropertyDecodeException e = assertThrows(PropertyDecodeException.class,
                () -> r.textEnum("Other", MenuShortcut.class, null));
        assertTrue(e.getMessage().contains("'^A', '^B'"), e.getMessage());
    }

    @Test
    void manualStartUpPositionTakesClientGeometry() throws Exception {
        PropertyReader manual = reader("StartUpPosition", "0", "ClientLeft", "60", "ClientTop", "345",
                "ClientWidth", "4680", "ClientHeight", "3195");
        assertEquals(StartUpPosition.manual(60, 345, 4680, 3195), manual.startUpPosition(StartUpPosition.WINDOWS_DEFAULT));

        PropertyReader centered = reader("StartUpPosition", "2");
        assertEquals(StartUpPosition.of(StartUpPosition.Kind.CENTER_SCREEN),
                centered.startUpPosition(StartUpPosition.WINDOWS_DEFAULT));
    }

    @Test
    void listsComeFromCompanionListRecords() throws Exception {
        byte[] record = {0x02, 0x00, 0x03, 0x00, 0x03, 0x00, 'O', 'n', 'e', 0x03, 0x00, 'T', 'w', 'o'};
        Properties.Builder b = Properties.builder();
        b.put("List", PropertyValue.resource(record));
        b.put("ItemData", PropertyValue.resource(new byte[]{'x', 'y'}));
        PropertyReader r = new PropertyReader(b.build());

        assertEquals(List.of("One", "Two"), r.list("List", List.of()));
        assertThrows(PropertyDecodeException.class, () -> r.list("ItemData", List.of()));
    }

    @Test
    void passwordCharIsFirstCharacterOrAbsent() {
        PropertyReader r = reader("A", "*", "B", "");
        assertEquals("*", r.character("A", null));
        assertNull(r.character("B", "#"));
        assertEquals("#", r.character("C", "#"));
    }
}
