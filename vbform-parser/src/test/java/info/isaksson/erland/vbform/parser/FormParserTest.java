package info.isaksson.erland.vbform.parser;

import info.isaksson.erland.vbform.model.ControlKind;
import info.isaksson.erland.vbform.model.ControlNode;
import info.isaksson.erland.vbform.model.FormDocument;
import info.isaksson.erland.vbform.model.FormVersion;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.props.FormBorderStyle;
import info.isaksson.erland.vbform.model.props.MenuShortcut;
import info.isaksson.erland.vbform.model.props.StartUpPosition;
import info.isaksson.erland.vbform.model.props.TitleBarButton;
import info.isaksson.erland.vbform.parser.resource.ResourceResolver;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class FormParserTest {

    private static final ResourceResolver NO_RESOURCES = (file, offset) -> {
        throw new IOException("no companion file " + file);
    };

    private static byte[] resource(String name) throws IOException {
        try (InputStream in = FormParserTest.class.getResourceAsStream(name)) {
            assertNotNull(in, "missing test resource " + name);
            return in.readAllBytes();
        }
    }

    @Test
    void parsesCompleteFormWithCompanionFile() throws Exception {
        String text = new String(resource("/forms/frmMain.frm"), PropertyValue.CODE_PAGE);
        ResourceResolver frx = ResourceResolver.ofBuffer(resource("/forms/frmMain.frx"));

        ParsedForm parsed = new FormParser(frx).parse("frmMain.frm", text);
        FormDocument doc = parsed.document;

        assertEquals(new FormVersion(5, 0), doc.version);
        assertEquals(2, doc.objects.size());
        assertEquals(UUID.fromString("831FDD16-0C5C-11D2-A9FC-0000F8754DA1"), doc.objects.get(0).uuid);
        assertEquals("2.0", doc.objects.get(0).version);
        assertEquals("MSCOMCTL.OCX", doc.objects.get(0).fileName);
        assertEquals("DAO350.DLL", doc.objects.get(1).fileName);

        ControlNode root = doc.root;
        assertEquals("frmMain", root.name);
        ControlKind.Form form = assertInstanceOf(ControlKind.Form.class, root.kind);
        assertEquals("Image Viewer", form.properties.caption);
        assertEquals(FormBorderStyle.FIXED_DIALOG, form.properties.borderStyle);
        assertEquals(TitleBarButton.EXCLUDED, form.properties.maxButton);
        assertEquals(StartUpPosition.manual(45, 330, 4680, 3195), form.properties.startUpPosition);
        assertArrayEquals(new byte[]{1, 2, 3, 4, 5, 6, 7, 8}, form.properties.icon.asBytes());

        assertEquals(2, form.controls.size());
        ControlKind.ListBox list = assertInstanceOf(ControlKind.ListBox.class, form.controls.get(0).kind);
        assertEquals(List.of("a.jpeg", "b.png"), list.properties.list);
        assertEquals(List.of("0", "0"), list.properties.itemData);

        ControlNode frame = form.controls.get(1);
        assertEquals("Preview", ((ControlKind.Frame) frame.kind).properties.caption);
        assertEquals("700", frame.kind.propertyGroups.get(0).getText("Weight"));
        ControlKind.Custom progress = assertInstanceOf(ControlKind.Custom.class, frame.kind.children().get(0).kind);
        assertEquals("393216", progress.properties.getText("_Version"));
        ControlNode image = frame.kind.children().get(1);
        assertEquals("preview", image.tag);
        assertTrue(((ControlKind.Image) image.kind).properties.stretch);

        assertEquals(1, form.menus.size());
        List<ControlNode> items = form.menus.get(0).kind.menus();
        assertEquals(3, items.size());
        assertEquals(MenuShortcut.CTRL_O, ((ControlKind.Menu) items.get(0).kind).properties.shortcut);
        assertEquals("-", ((ControlKind.Menu) items.get(1).kind).properties.caption);

        assertEquals("frmMain", doc.attributes.name);
        assertTrue(doc.attributes.predeclaredId);
        assertFalse(doc.attributes.exposed);
        assertTrue(text.substring(parsed.codeOffset).startsWith("Option Explicit"));
    }

    @Test
    void headerIsOptional() throws Exception {
        ParsedForm parsed = new FormParser(NO_RESOURCES).parse("a.frm", "Begin VB.Form F1\nEnd\n");

        assertEquals(FormVersion.DEFAULT, parsed.document.version);
        assertEquals(List.of(), parsed.document.objects);
        assertEquals("F1", parsed.document.attributes.name);
        assertTrue(parsed.document.attributes.predeclaredId);
        assertEquals("Begin VB.Form F1\nEnd\n".length(), parsed.codeOffset);
    }

    @Test
    void versionLineMayCarryClassSuffix() throws Exception {
        ParsedForm parsed = new FormParser(NO_RESOURCES).parse("a.frm", "VERSION 6.01 CLASS\nBegin VB.Form F1\nEnd\n");

        assertEquals(new FormVersion(6, 1), parsed.document.version);
    }

    @Test
    void nameAttributeRenamesRootAndUnknownAttributesAreKept() throws Exception {
        String text = """
                VERSION 5.00
                Begin VB.Form Form1
                End
                Attribute VB_Name = "frmRenamed"
                Attribute VB_Exposed = True
                Attribute VB_Description = "Main window"

                Private Sub Form_Load()
                End Sub
                """;

        ParsedForm parsed = new FormParser(NO_RESOURCES).parse("a.frm", text);

        assertEquals("frmRenamed", parsed.document.root.name);
        assertEquals("frmRenamed", parsed.document.attributes.name);
        assertTrue(parsed.document.attributes.exposed);
        assertEquals("Main window", parsed.document.attributes.extensionKeys.get("VB_Description"));
        assertEquals(text.indexOf("Private Sub"), parsed.codeOffset);
    }

    @Test
    void malformedObjectGuidIsInvalidGuid() {
        FormParseException e = assertThrows(FormParseException.class, () -> new FormParser(NO_RESOURCES).parse("a.frm", """
                VERSION 5.00
                Object = "{831FDD16-0C5C-11D2}#2.0#0"; "MSCOMCTL.OCX"
                Begin VB.Form F1
                End
                """));

        assertEquals(FormErrorKind.INVALID_GUID, e.getKind());
        assertEquals(2, e.getLineNumber());
        assertEquals("a.frm", e.getFileName());
    }

    @Test
    void strayHeaderLineIsInvalidHeader() {
        FormParseException e = assertThrows(FormParseException.class,
                () -> new FormParser(NO_RESOURCES).parse("a.frm", "VERSION 5.00\nHello\nBegin VB.Form F1\nEnd\n"));

        assertEquals(FormErrorKind.INVALID_HEADER, e.getKind());
        assertEquals(2, e.getLineNumber());
    }

    @Test
    void missingControlTreeIsInvalidHeader() {
        FormParseException e = assertThrows(FormParseException.class,
                () -> new FormParser(NO_RESOURCES).parse("a.frm", "VERSION 5.00\n\n"));

        assertEquals(FormErrorKind.INVALID_HEADER, e.getKind());
    }

    @Test
    void invalidAttributeFlag() {
        FormParseException e = assertThrows(FormParseException.class, () -> new FormParser(NO_RESOURCES).parse("a.frm",
                "Begin VB.Form F1\nEnd\nAttribute VB_Creatable = Maybe\n"));

        assertEquals(FormErrorKind.INVALID_PROPERTY_VALUE, e.getKind());
        assertEquals(3, e.getLineNumber());
    }
}
