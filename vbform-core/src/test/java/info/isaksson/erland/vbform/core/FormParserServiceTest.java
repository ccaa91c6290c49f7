package info.isaksson.erland.vbform.core;

import info.isaksson.erland.vbform.model.ControlKind;
import info.isaksson.erland.vbform.model.FormDocument;
import info.isaksson.erland.vbform.parser.FormErrorKind;
import info.isaksson.erland.vbform.parser.FormParseException;
import info.isaksson.erland.vbform.parser.resource.ResourceResolver;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class FormParserServiceTest {

    private static final String FORM = """
            VERSION 5.00
            Begin VB.Form frmAbout
               Caption         =   "About"
               Icon            =   "frmAbout.frx":0000
               Begin VB.Label lblTitle
                  Caption         =   "frmAbout.frx":0003
               End
            End
            Attribute VB_Name = "frmAbout"
            Option Explicit
            """;

    private static final byte[] FRX = {0x02, 'h', 'i', 0x05, 'T', 'i', 't', 'l', 'e'};

    @Test
    void parseReadsCompanionFileNextToTheForm() throws Exception {
        Path dir = Files.createTempDirectory("vbform-svc-");
        Files.write(dir.resolve("frmAbout.frx"), FRX);
        Path frm = dir.resolve("frmAbout.frm");

        FormParseResult result = new FormParserService().parse(frm.toString(), FORM);

        FormDocument doc = result.document;
        ControlKind.Form form = (ControlKind.Form) doc.root.kind;
        assertEquals("hi", form.properties.icon.asText());
        assertEquals("Title", ((ControlKind.Label) form.controls.get(0).kind).properties.caption);
        assertEquals("Option Explicit\n", result.code(FORM));
        assertTrue(result.elapsedMillis >= 0);
    }

    @Test
    void explicitBaseDirectoryWins() throws Exception {
        Path dir = Files.createTempDirectory("vbform-svc-");
        Files.write(dir.resolve("frmAbout.frx"), FRX);
        FormParseOptions options = new FormParseOptions();
        options.resourceBaseDir = dir;

        FormParseResult result = new FormParserService(options).parse("elsewhere/frmAbout.frm", FORM);

        assertEquals("frmAbout", result.document.root.name);
    }

    @Test
    void missingCompanionFileIsResourceError() throws Exception {
        Path dir = Files.createTempDirectory("vbform-svc-");

        FormParseException e = assertThrows(FormParseException.class,
                () -> new FormParserService().parse(dir.resolve("frmAbout.frm").toString(), FORM));

        assertEquals(FormErrorKind.RESOURCE_FILE_IO_ERROR, e.getKind());
        assertEquals(4, e.getLineNumber());
        assertEquals(FORM.indexOf("   Icon"), e.getLineStart());
    }

    @Test
    void companionFileMustStayInsideFormDirectory() throws Exception {
        Path dir = Files.createTempDirectory("vbform-svc-");
        Path forms = Files.createDirectories(dir.resolve("forms"));
        Files.write(dir.resolve("secret.bin"), FRX);
        String text = "Begin VB.Form F1\r\n   Tag = $\"..\\secret.bin\":0000\r\nEnd\r\n";

        FormParseException e = assertThrows(FormParseException.class,
                () -> new FormParserService().parse(forms.resolve("F1.frm").toString(), text));

        assertEquals(FormErrorKind.RESOURCE_FILE_IO_ERROR, e.getKind());
        assertEquals(2, e.getLineNumber());
    }

    @Test
    void invalidCompanionFileNameIsResourceError() throws Exception {
        Path dir = Files.createTempDirectory("vbform-svc-");
        String text = "Begin VB.Form F1\n   Tag = $\"a\0b.frx\":0000\nEnd\n";

        FormParseException e = assertThrows(FormParseException.class,
                () -> new FormParserService().parse(dir.resolve("F1.frm").toString(), text));

        assertEquals(FormErrorKind.RESOURCE_FILE_IO_ERROR, e.getKind());
    }

    @Test
    void injectedResolverAndDeterministicJson() throws Exception {
        FormParserService service = new FormParserService();
        ResourceResolver frx = ResourceResolver.ofBuffer(FRX);

        FormDocument first = service.parseWithResolver("frmAbout.frm", FORM, frx).document;
        FormDocument second = service.parseWithResolver("frmAbout.frm", FORM, frx).document;

        String json = service.toJson(first);
        assertEquals(json, service.toJson(second));
        assertTrue(json.contains("\"name\" : \"lblTitle\""), json);

        Path out = Files.createTempDirectory("vbform-svc-").resolve("about.json");
        service.writeJson(first, out);
        assertEquals(json, Files.readString(out, StandardCharsets.UTF_8));
    }

    @Test
    void nestingLimitComesFromOptions() {
        FormParseOptions options = new FormParseOptions();
        options.maxNestingDepth = 1;
        String text = "Begin VB.Form F1\n Begin VB.Label l\n End\nEnd\n";

        FormParseException e = assertThrows(FormParseException.class,
                () -> new FormParserService(options).parseWithResolver("a.frm", text, ResourceResolver.ofBuffer(new byte[0])));
        assertEquals(FormErrorKind.NESTING_TOO_DEEP, e.getKind());
    }

    @Test
    void rejectsNullArguments() {
        FormParserService service = new FormParserService();
        assertThrows(IllegalArgumentException.class, () -> service.parse(null, FORM));
        assertThrows(IllegalArgumentException.class, () -> service.parseWithResolver("a.frm", null, (f, o) -> new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> service.parseWithResolver("a.frm", FORM, null));
    }
}
