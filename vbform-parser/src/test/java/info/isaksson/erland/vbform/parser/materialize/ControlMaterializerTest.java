package info.isaksson.erland.vbform.parser.materialize;

import info.isaksson.erland.vbform.model.Color;
import info.isaksson.erland.vbform.model.ControlKind;
import info.isaksson.erland.vbform.model.ControlNode;
import info.isaksson.erland.vbform.model.Properties;
import info.isaksson.erland.vbform.model.PropertyGroup;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.json.FormJson;
import info.isaksson.erland.vbform.model.props.Appearance;
import info.isaksson.erland.vbform.model.props.Connection;
import info.isaksson.erland.vbform.model.props.MenuShortcut;
import info.isaksson.erland.vbform.parser.FormErrorKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ControlMaterializerTest {

    private final ControlMaterializer materializer = new ControlMaterializer();

    private static Properties props(String... keyValues) {
        Properties.Builder b = Properties.builder();
        for (int i = 0; i < keyValues.length; i += 2) b.putText(keyValues[i], keyValues[i + 1]);
        return b.build();
    }

    private ControlNode leaf(String namespace, String kind, Properties properties) throws PropertyDecodeException {
        return materializer.materialize(namespace, kind, "c1", properties, List.of(), List.of(), List.of());
    }

    @Test
    void builtinControlStartsFromIdeDefaults() throws Exception {
        ControlNode node = leaf("VB", "CommandButton", props("Caption", "OK", "Default", "-1"));

        ControlKind.CommandButton button = assertInstanceOf(ControlKind.CommandButton.class, node.kind);
        assertEquals("OK", button.properties.caption);
        assertTrue(button.properties.defaultButton);
        assertEquals(Appearance.THREE_D, button.properties.appearance);
        assertEquals(Color.BUTTON_FACE, button.properties.backColor);
        assertEquals(100, button.properties.width);
        assertEquals("", node.tag);
        assertEquals(0, node.index);
    }

    @Test
    void tagAndIndexComeFromProperties() throws Exception {
        ControlNode node = leaf("VB", "Label", props("Tag", "hello", "Index", "3"));

        assertEquals("hello", node.tag);
        assertEquals(3, node.index);
        assertEquals(ControlKind.Type.LABEL, node.kind.type());
    }

    @Test
    void foreignNamespaceIsPassedThroughUntouched() throws Exception {
        byte[] blob = {0, 1, 2, (byte) 0xFF};
        Properties.Builder b = Properties.builder();
        b.putText("Appearance", "99");
        b.put("OleObjectBlob", PropertyValue.resource(blob));
        Properties raw = b.build();
        PropertyGroup group = new PropertyGroup("Panels", null, Map.of());

        ControlNode node = materializer.materialize("ComctlLib", "StatusBar", "sb", raw, List.of(group), List.of(), List.of());

        ControlKind.Custom custom = assertInstanceOf(ControlKind.Custom.class, node.kind);
        assertEquals("ComctlLib", custom.namespace);
        assertEquals("StatusBar", custom.kind);
        assertEquals(raw, custom.properties);
        assertArrayEquals(blob, custom.properties.get("OleObjectBlob").asBytes());
        assertEquals(List.of(group), custom.propertyGroups);
    }

    @Test
    void unknownBuiltinKindIsRejected() {
        PropertyDecodeException e = assertThrows(PropertyDecodeException.class,
                () -> leaf("VB", "Gizmo", Properties.empty()));

        assertEquals(FormErrorKind.UNKNOWN_CONTROL_KIND, e.getKind());
        assertNull(e.getPropertyName());
    }

    @Test
    void invalidValueNamesTheProperty() {
        PropertyDecodeException e = assertThrows(PropertyDecodeException.class,
                () -> leaf("VB", "TextBox", props("MultiLine", "7")));

        assertEquals(FormErrorKind.INVALID_PROPERTY_VALUE, e.getKind());
        assertEquals("MultiLine", e.getPropertyName());
    }

    @Test
    void stringCodedProperties() throws Exception {
        ControlNode data = leaf("VB", "Data", props("Connect", "Access"));
        assertEquals(Connection.ACCESS, ((ControlKind.Data) data.kind).properties.connection);

        ControlNode menu = materializer.materialize("VB", "Menu", "mnuOpen", props("Caption", "&Open", "Shortcut", "^O"),
                List.of(), List.of(), List.of());
        assertEquals(MenuShortcut.CTRL_O, ((ControlKind.Menu) menu.kind).properties.shortcut);
    }

    @Test
    void containersKeepChildrenAndMenusSeparately() throws Exception {
        ControlNode child = leaf("VB", "CommandButton", props());
        ControlNode menu = materializer.materialize("VB", "Menu", "mnuFile", props(), List.of(), List.of(), List.of());

        ControlNode form = materializer.materialize("VB", "Form", "Form1", props(), List.of(), List.of(child), List.of(menu));

        assertEquals(List.of(child), form.kind.children());
        assertEquals(List.of(menu), form.kind.menus());
    }

    @Test
    void childRules() {
        assertTrue(ControlMaterializer.acceptsChild(ControlKind.Type.FORM, ControlKind.Type.MENU));
        assertTrue(ControlMaterializer.acceptsChild(ControlKind.Type.MENU, ControlKind.Type.MENU));
        assertTrue(ControlMaterializer.acceptsChild(ControlKind.Type.PICTURE_BOX, ControlKind.Type.TEXT_BOX));
        assertTrue(ControlMaterializer.acceptsChild(ControlKind.Type.CUSTOM, ControlKind.Type.LABEL));
        assertFalse(ControlMaterializer.acceptsChild(ControlKind.Type.MENU, ControlKind.Type.TEXT_BOX));
        assertFalse(ControlMaterializer.acceptsChild(ControlKind.Type.FRAME, ControlKind.Type.MENU));
        assertFalse(ControlMaterializer.acceptsChild(ControlKind.Type.TEXT_BOX, ControlKind.Type.LABEL));
    }

    @Test
    void materializingTwiceGivesIdenticalOutput() throws Exception {
        Properties raw = props("Caption", "Main", "BackColor", "&H00C0FFC0&", "StartUpPosition", "3", "KeyPreview", "-1");

        ControlNode a = materializer.materialize("VB", "Form", "Form1", raw, List.of(), List.of(), List.of());
        ControlNode b = materializer.materialize("VB", "Form", "Form1", raw, List.of(), List.of(), List.of());

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(FormJson.toJsonString(a), FormJson.toJsonString(b));
        assertNotEquals(a, materializer.materialize("VB", "Form", "Form1", props("Caption", "Other"),
                List.of(), List.of(), List.of()));
    }
}
