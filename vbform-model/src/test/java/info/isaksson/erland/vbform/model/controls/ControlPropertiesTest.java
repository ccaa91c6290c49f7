package info.isaksson.erland.vbform.model.controls;

import info.isaksson.erland.vbform.model.ControlKind;
import info.isaksson.erland.vbform.model.ControlNode;
import info.isaksson.erland.vbform.model.props.Activation;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ControlPropertiesTest {

    private static final List<Class<?>> PROPERTY_CLASSES = List.of(
            CheckBoxProperties.class, ComboBoxProperties.class, CommandButtonProperties.class,
            DataProperties.class, DirListBoxProperties.class, DriveListBoxProperties.class,
            FileListBoxProperties.class, FormProperties.class, FrameProperties.class,
            ImageProperties.class, LabelProperties.class, LineProperties.class,
            ListBoxProperties.class, MdiFormProperties.class, MenuProperties.class,
            OleProperties.class, OptionButtonProperties.class, PictureBoxProperties.class,
            ScrollBarProperties.class, ShapeProperties.class, TextBoxProperties.class,
            TimerProperties.class);

    @Test
    void everyPropertyFieldIsFinal() {
        List<String> mutable = new ArrayList<>();
        for (Class<?> c : PROPERTY_CLASSES) {
            for (Field f : c.getDeclaredFields()) {
                if (!Modifier.isStatic(f.getModifiers()) && !Modifier.isFinal(f.getModifiers())) {
                    mutable.add(c.getSimpleName() + "." + f.getName());
                }
            }
        }
        assertTrue(mutable.isEmpty(), "mutable fields: " + mutable);
    }

    @Test
    void builderChangesDoNotReachBuiltInstances() {
        ListBoxProperties.Builder b = new ListBoxProperties.Builder();
        List<String> items = new ArrayList<>(List.of("one", "two"));
        b.list = items;
        ListBoxProperties built = b.build();

        items.add("three");
        b.list = List.of();

        assertEquals(List.of("one", "two"), built.list);
        assertThrows(UnsupportedOperationException.class, () -> built.list.add("four"));
    }

    @Test
    void defaultsMatchFreshBuilder() {
        assertEquals(new TimerProperties(), new TimerProperties.Builder().build());
        assertEquals(new FormProperties().hashCode(), new FormProperties.Builder().build().hashCode());
        assertEquals("Form1", new FormProperties().caption);
    }

    @Test
    void nodesCompareByValue() {
        TimerProperties.Builder t = new TimerProperties.Builder();
        t.interval = 500;
        ControlNode a = new ControlNode("tmr", "", 0, new ControlKind.Timer(t.build(), List.of()));
        ControlNode b = new ControlNode("tmr", "", 0, new ControlKind.Timer(t.build(), List.of()));
        t.enabled = Activation.DISABLED;
        ControlNode c = new ControlNode("tmr", "", 0, new ControlKind.Timer(t.build(), List.of()));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
        assertNotEquals(a, a.withName("tmr2"));
    }
}
