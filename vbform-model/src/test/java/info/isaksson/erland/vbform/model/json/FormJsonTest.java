package info.isaksson.erland.vbform.model.json;

import info.isaksson.erland.vbform.model.ControlKind;
import info.isaksson.erland.vbform.model.ControlNode;
import info.isaksson.erland.vbform.model.FileAttributes;
import info.isaksson.erland.vbform.model.FormDocument;
import info.isaksson.erland.vbform.model.FormVersion;
import info.isaksson.erland.vbform.model.ObjectReference;
import info.isaksson.erland.vbform.model.Properties;
import info.isaksson.erland.vbform.model.PropertyGroup;
import info.isaksson.erland.vbform.model.PropertyGroupEntry;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.controls.CommandButtonProperties;
import info.isaksson.erland.vbform.model.controls.FormProperties;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class FormJsonTest {

    private static FormDocument sample() {
        Map<String, PropertyGroupEntry> font = new LinkedHashMap<>();
        font.put("Name", PropertyGroupEntry.scalar(PropertyValue.text("Tahoma")));
        PropertyGroup group = new PropertyGroup("Font", UUID.fromString("0BE35203-8F91-11CE-9DE3-00AA004BB851"), font);

        Properties.Builder raw = Properties.builder();
        raw.putText("Zeta", "1");
        raw.putText("Alpha", "2");
        ControlNode custom = new ControlNode("pb", "", 0,
                new ControlKind.Custom("MSComctlLib", "ProgressBar", raw.build(), List.of(), List.of()));

        CommandButtonProperties.Builder ok = new CommandButtonProperties.Builder();
        ok.caption = "OK";
        ControlNode button = new ControlNode("cmdOk", "", 0, new ControlKind.CommandButton(ok.build(), List.of(group)));

        ControlNode root = new ControlNode("Form1", "", 0,
                new ControlKind.Form(new FormProperties(), List.of(button, custom), List.of(), List.of()));
        ObjectReference ocx = new ObjectReference(UUID.fromString("831FDD16-0C5C-11D2-A9FC-0000F8754DA1"), "2.0", "0", "MSCOMCTL.OCX");
        return new FormDocument(root, FormVersion.DEFAULT, List.of(ocx), FileAttributes.defaults("Form1"));
    }

    @Test
    void outputIsDeterministicAndTagged() throws Exception {
        String a = FormJson.toJsonString(sample());
        String b = FormJson.toJsonString(sample());

        assertEquals(a, b);
        assertTrue(a.endsWith("}\n"));
        assertTrue(a.contains("\"type\" : \"Form\""), a);
        assertTrue(a.contains("\"type\" : \"CommandButton\""), a);
        assertTrue(a.contains("\"type\" : \"Custom\""), a);
        assertTrue(a.contains("\"guid\" : \"0be35203-8f91-11ce-9de3-00aa004bb851\""), a);
        assertTrue(a.indexOf("\"Alpha\"") < a.indexOf("\"Zeta\""), "map keys are sorted");
        assertTrue(a.indexOf("\"version\"") < a.indexOf("\"root\""));
    }

    @Test
    void resourceValuesAreBase64() throws Exception {
        ControlNode node = new ControlNode("x", "", 0, new ControlKind.Custom("Lib", "X",
                singleResource(), List.of(), List.of()));

        String json = FormJson.toJsonString(node);

        assertTrue(json.contains("\"resource\" : \"AQID\""), json);
        assertFalse(json.contains("\"text\" : null"), json);
    }

    private static Properties singleResource() {
        Properties.Builder b = Properties.builder();
        b.put("Blob", PropertyValue.resource(new byte[]{1, 2, 3}));
        return b.build();
    }

    @Test
    void writesToFile() throws Exception {
        Path dir = Files.createTempDirectory("vbform-json-");
        Path out = dir.resolve("nested/form.json");

        FormJson.write(sample(), out);

        assertEquals(FormJson.toJsonString(sample()), Files.readString(out));
    }
}
