package info.isaksson.erland.vbform.model.props;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class VbEnumsTest {

    @Test
    void looksUpByCode() {
        assertEquals(Optional.of(Activation.ENABLED), VbEnums.fromCode(Activation.class, -1));
        assertEquals(Optional.of(FormBorderStyle.FIXED_DIALOG), VbEnums.fromCode(FormBorderStyle.class, 3));
        assertEquals(Optional.empty(), VbEnums.fromCode(Appearance.class, 2));
    }

    @Test
    void describesValuesLikeTheIde() {
        assertEquals("0 (Flat), or 1 (ThreeD)", VbEnums.describeValues(Appearance.class));
        assertEquals("0 (None), 1 (FixedSingle), 2 (Sizable), 3 (FixedDialog), 4 (FixedToolWindow), or 5 (SizableToolWindow)",
                VbEnums.describeValues(FormBorderStyle.class));
    }

    @Test
    void textCodedLookup() {
        assertEquals(Optional.of(MenuShortcut.SHIFT_CTRL_F1), TextCodedEnum.fromText(MenuShortcut.class, "+^{F1}"));
        assertEquals(Optional.of(Connection.ACCESS), TextCodedEnum.fromText(Connection.class, "Access"));
        assertEquals(Optional.empty(), TextCodedEnum.fromText(MenuShortcut.class, "{F10}"));
        assertTrue(TextCodedEnum.describeValues(Connection.class).startsWith("'Access', "));
    }

    @Test
    void everyEnumHasDistinctCodes() {
        Class<?>[] types = {Appearance.class, BorderStyle.class, MousePointer.class, DrawMode.class,
                ScaleMode.class, ShapeType.class, WindowState.class, ComboBoxStyle.class};
        for (Class<?> t : types) {
            Object[] constants = t.getEnumConstants();
            Set<Integer> codes = new HashSet<>();
            for (Object c : constants) {
                assertTrue(codes.add(((VbEnum) c).code()), t.getSimpleName() + " repeats code " + ((VbEnum) c).code());
            }
        }
    }
}
