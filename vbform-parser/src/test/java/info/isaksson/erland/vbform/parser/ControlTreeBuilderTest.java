package info.isaksson.erland.vbform.parser;

import info.isaksson.erland.vbform.model.ControlKind;
import info.isaksson.erland.vbform.model.ControlNode;
import info.isaksson.erland.vbform.parser.resource.ResourceResolver;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class ControlTreeBuilderTest {

    private static final ResourceResolver NO_RESOURCES = (file, offset) -> {
        throw new IOException("no companion file " + file);
    };

    private static ControlNode build(String text) throws FormParseException {
        return build(text, NO_RESOURCES);
    }

    private static ControlNode build(String text, ResourceResolver resolver) throws FormParseException {
        return new ControlTreeBuilder(resolver, 256).build(new FormSource("Test.frm", text));
    }

    @Test
    void menusNestUnderFormAndOtherMenus() throws Exception {
        ControlNode root = build("""
                Begin VB.Form F1
                   Caption = "Menus"
                   Begin VB.Menu mnuFile
                      Caption = "&File"
                      Begin VB.Menu mnuOpenImage
                         Caption = "&Open image"
                      End
                   End
                End
                """);

        ControlKind.Form form = assertInstanceOf(ControlKind.Form.class, root.kind);
        assertEquals("F1", root.name);
        assertEquals(0, form.controls.size());
        assertEquals(1, form.menus.size());
        ControlNode file = form.menus.get(0);
        assertEquals("mnuFile", file.name);
        assertEquals(1, file.kind.menus().size());
        assertEquals("mnuOpenImage", file.kind.menus().get(0).name);
        assertEquals("&Open image", ((ControlKind.Menu) file.kind.menus().get(0).kind).properties.caption);
    }

    @Test
    void nestedContainersAndPropertyGroups() throws Exception {
        ControlNode root = build("""
                Begin VB.Form frmMain
                   ClientHeight    =   3195
                   Begin VB.Frame fraOptions
                      Caption         =   "Options"
                      BeginProperty Font {0BE35203-8F91-11CE-9DE3-00AA004BB851}
                         Name            =   "Tahoma"
                      EndProperty
                      Begin VB.CheckBox chkA
                         Value           =   1  'Checked
                      End
                   End
                   Begin VB.PictureBox picHost
                      Begin VB.Label lblInside
                         Caption = "x"
                      End
                   End
                End
                """);

        ControlKind.Form form = (ControlKind.Form) root.kind;
        assertEquals(3195, form.properties.clientHeight);
        assertEquals(2, form.controls.size());
        ControlNode frame = form.controls.get(0);
        assertEquals(ControlKind.Type.FRAME, frame.kind.type());
        assertEquals("Tahoma", frame.kind.propertyGroups.get(0).getText("Name"));
        assertEquals("chkA", frame.kind.children().get(0).name);
        assertEquals("lblInside", form.controls.get(1).kind.children().get(0).name);
    }

    @Test
    void keywordsAreCaseInsensitive() throws Exception {
        ControlNode root = build("begin VB.Form F1\r\n  begin VB.CommandButton cmd\r\n  end\r\nEND\r\n");

        assertEquals(1, root.kind.children().size());
    }

    @Test
    void resourceReferencesAreResolvedEagerly() throws Exception {
        byte[] frx = {(byte) 0xFF, 0x05, 0x00, 'H', 'e', 'l', 'l'};
        ControlNode root = build("""
                Begin VB.Form F1
                   Begin VB.TextBox txt
                      Text            =   "Form1.frx":0000
                   End
                End
                """, ResourceResolver.ofBuffer(frx));

        ControlKind.TextBox box = (ControlKind.TextBox) root.kind.children().get(0).kind;
        assertEquals("Hell", box.properties.text);
    }

    @Test
    void failingResolverAbortsTheParse() {
        FormParseException e = assertThrows(FormParseException.class, () -> build("""
                Begin VB.Form F1
                   Icon            =   "Form1.frx":0000
                End
                """));

        assertEquals(FormErrorKind.RESOURCE_FILE_IO_ERROR, e.getKind());
        assertEquals(FormErrorKind.Category.RESOURCE, e.getKind().category());
        assertEquals(2, e.getLineNumber());
    }

    @Test
    void corruptedRecordIsReportedWithItsLine() {
        byte[] frx = {0x10, 0x00, 0x00, 0x00, 'a'};
        FormParseException e = assertThrows(FormParseException.class, () -> build("""
                Begin VB.Form F1
                   Picture         =   "Form1.frx":0000
                End
                """, ResourceResolver.ofBuffer(frx)));

        assertEquals(FormErrorKind.CORRUPTED_RESOURCE, e.getKind());
        assertEquals(2, e.getLineNumber());
    }

    @Test
    void missingEndIsUnterminated() {
        FormParseException e = assertThrows(FormParseException.class, () -> build("""
                Begin VB.Form F1
                   Begin VB.Label l1
                   End
                """));

        assertEquals(FormErrorKind.UNTERMINATED_CONTROL_BLOCK, e.getKind());
        assertTrue(e.getDetail().contains("'F1'"), e.getDetail());
    }

    @Test
    void beginWithoutNamespaceDot() {
        FormParseException e = assertThrows(FormParseException.class, () -> build("Begin Form F1\nEnd\n"));

        assertEquals(FormErrorKind.MISSING_NAMESPACE_DOT, e.getKind());
        assertEquals(6, e.getOffset());
    }

    @Test
    void beginWithoutControlName() {
        FormParseException e = assertThrows(FormParseException.class, () -> build("Begin VB.Form\nEnd\n"));

        assertEquals(FormErrorKind.NO_CONTROL_NAME_AFTER_KIND, e.getKind());
    }

    @Test
    void controlInsideMenuIsUnexpected() {
        FormParseException e = assertThrows(FormParseException.class, () -> build("""
                Begin VB.Form F1
                   Begin VB.Menu mnuFile
                      Begin VB.CommandButton cmd
                      End
                   End
                End
                """));

        assertEquals(FormErrorKind.UNEXPECTED_CHILD_KIND, e.getKind());
        assertEquals(3, e.getLineNumber());
    }

    @Test
    void controlInsideNonContainerIsUnexpected() {
        FormParseException e = assertThrows(FormParseException.class, () -> build("""
                Begin VB.Form F1
                   Begin VB.TextBox txt
                      Begin VB.Label l1
                      End
                   End
                End
                """));

        assertEquals(FormErrorKind.UNEXPECTED_CHILD_KIND, e.getKind());
    }

    @Test
    void unknownBuiltinKindPointsAtBeginLine() {
        FormParseException e = assertThrows(FormParseException.class, () -> build("""
                Begin VB.Form F1
                   Begin VB.Gizmo g1
                   End
                End
                """));

        assertEquals(FormErrorKind.UNKNOWN_CONTROL_KIND, e.getKind());
        assertEquals(2, e.getLineNumber());
    }

    @Test
    void foreignControlsAreCustom() throws Exception {
        ControlNode root = build("""
                Begin VB.Form F1
                   Begin MSComctlLib.ProgressBar pb
                      Max             =   500
                      _Version        =   393216
                   End
                End
                """);

        ControlKind.Custom custom = assertInstanceOf(ControlKind.Custom.class, root.kind.children().get(0).kind);
        assertEquals("MSComctlLib", custom.namespace);
        assertEquals("ProgressBar", custom.kind);
        assertEquals("500", custom.properties.getText("Max"));
        assertEquals("393216", custom.properties.getText("_Version"));
    }

    @Test
    void invalidValueIsReportedAtItsOwnLine() {
        String text = """
                Begin VB.Form F1
                   Caption = "x"
                   Appearance = 5
                   Left = 10
                End
                """;
        FormParseException e = assertThrows(FormParseException.class, () -> build(text));

        assertEquals(FormErrorKind.INVALID_PROPERTY_VALUE, e.getKind());
        assertEquals(3, e.getLineNumber());
        assertEquals(text.indexOf("   Appearance"), e.getLineStart());
        assertEquals(text.indexOf("\n   Left"), e.getLineEnd());
        assertTrue(e.getMessage().contains("Only 0 (Flat), or 1 (ThreeD) are valid values."), e.getMessage());
    }

    @Test
    void lastAssignmentWins() throws Exception {
        ControlNode root = build("Begin VB.Form F1\n"
                + "   Caption = \"first\"\n"
                + "   Caption = \"second \"\"quoted\"\"\"\n"
                + "End\n");

        assertEquals("second \"quoted\"", ((ControlKind.Form) root.kind).properties.caption);
    }

    @Test
    void lineWithoutAssignmentIsUnparsable() {
        FormParseException e = assertThrows(FormParseException.class, () -> build("""
                Begin VB.Form F1
                   Caption
                End
                """));

        assertEquals(FormErrorKind.PROPERTY_VALUE_UNPARSABLE, e.getKind());
    }

    @Test
    void nestingLimitApplies() {
        String text = "Begin VB.Form F1\n Begin VB.Frame a\n  Begin VB.Frame b\n  End\n End\nEnd\n";
        FormParseException e = assertThrows(FormParseException.class,
                () -> new ControlTreeBuilder(NO_RESOURCES, 2).build(new FormSource("t.frm", text)));

        assertEquals(FormErrorKind.NESTING_TOO_DEEP, e.getKind());
        assertEquals(3, e.getLineNumber());
    }
}
