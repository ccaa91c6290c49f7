package info.isaksson.erland.vbform.model.controls;

import com.fasterxml.jackson.annotation.JsonInclude;
import info.isaksson.erland.vbform.model.Color;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.props.Activation;
import info.isaksson.erland.vbform.model.props.Appearance;
import info.isaksson.erland.vbform.model.props.CausesValidation;
import info.isaksson.erland.vbform.model.props.ComboBoxStyle;
import info.isaksson.erland.vbform.model.props.DragMode;
import info.isaksson.erland.vbform.model.props.MousePointer;
import info.isaksson.erland.vbform.model.props.OleDragMode;
import info.isaksson.erland.vbform.model.props.OleDropMode;
import info.isaksson.erland.vbform.model.props.TabStop;
import info.isaksson.erland.vbform.model.props.TextDirection;
import info.isaksson.erland.vbform.model.props.Visibility;

import java.util.List;
import java.util.Objects;

/** A combo box. {@code List} and {@code ItemData} may come from the resource file. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ComboBoxProperties {
    public final Appearance appearance;
    public final Color backColor;
    public final CausesValidation causesValidation;
    public final String dataField;
    public final String dataFormat;
    public final String dataMember;
    public final String dataSource;
    public final PropertyValue dragIcon;
    public final DragMode dragMode;
    public final Activation enabled;
    public final Color foreColor;
    public final int helpContextId;
    public final boolean integralHeight;
    public final boolean locked;
    public final PropertyValue mouseIcon;
    public final MousePointer mousePointer;
    public final OleDragMode oleDragMode;
    public final OleDropMode oleDropMode;
    public final TextDirection rightToLeft;
    public final boolean sorted;
    public final ComboBoxStyle style;
    public final int tabIndex;
    public final TabStop tabStop;
    public final String text;
    public final String toolTipText;
    public final Visibility visible;
    public final int whatsThisHelpId;
    public final int height;
    public final int left;
    public final int top;
    public final int width;
    public final List<String> itemData;
    public final List<String> list;

    /** All properties at their IDE defaults. */
    public ComboBoxProperties() {
        this(new Builder());
    }

    private ComboBoxProperties(Builder b) {
        this.appearance = b.appearance;
        this.backColor = b.backColor;
        this.causesValidation = b.causesValidation;
        this.dataField = b.dataField;
        this.dataFormat = b.dataFormat;
        this.dataMember = b.dataMember;
        this.dataSource = b.dataSource;
        this.dragIcon = b.dragIcon;
        this.dragMode = b.dragMode;
        this.enabled = b.enabled;
        this.foreColor = b.foreColor;
        this.helpContextId = b.helpContextId;
        this.integralHeight = b.integralHeight;
        this.locked = b.locked;
        this.mouseIcon = b.mouseIcon;
        this.mousePointer = b.mousePointer;
        this.oleDragMode = b.oleDragMode;
        this.oleDropMode = b.oleDropMode;
        this.rightToLeft = b.rightToLeft;
        this.sorted = b.sorted;
        this.style = b.style;
        this.tabIndex = b.tabIndex;
        this.tabStop = b.tabStop;
        this.text = b.text;
        this.toolTipText = b.toolTipText;
        this.visible = b.visible;
        this.whatsThisHelpId = b.whatsThisHelpId;
        this.height = b.height;
        this.left = b.left;
        this.top = b.top;
        this.width = b.width;
        this.itemData = b.itemData == null ? List.of() : List.copyOf(b.itemData);
        this.list = b.list == null ? List.of() : List.copyOf(b.list);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComboBoxProperties)) return false;
        ComboBoxProperties that = (ComboBoxProperties) o;
        return Objects.equals(appearance, that.appearance)
                && Objects.equals(backColor, that.backColor)
                && Objects.equals(causesValidation, that.causesValidation)
                && Objects.equals(dataField, that.dataField)
                && Objects.equals(dataFormat, that.dataFormat)
                && Objects.equals(dataMember, that.dataMember)
                && Objects.equals(dataSource, that.dataSource)
                && Objects.equals(dragIcon, that.dragIcon)
                && Objects.equals(dragMode, that.dragMode)
                && Objects.equals(enabled, that.enabled)
                && Objects.equals(foreColor, that.foreColor)
                && helpContextId == that.helpContextId
                && integralHeight == that.integralHeight
                && locked == that.locked
                && Objects.equals(mouseIcon, that.mouseIcon)
                && Objects.equals(mousePointer, that.mousePointer)
                && Objects.equals(oleDragMode, that.oleDragMode)
                && Objects.equals(oleDropMode, that.oleDropMode)
                && Objects.equals(rightToLeft, that.rightToLeft)
                && sorted == that.sorted
                && Objects.equals(style, that.style)
                && tabIndex == that.tabIndex
                && Objects.equals(tabStop, that.tabStop)
                && Objects.equals(text, that.text)
                && Objects.equals(toolTipText, that.toolTipText)
                && Objects.equals(visible, that.visible)
                && whatsThisHelpId == that.whatsThisHelpId
                && height == that.height
                && left == that.left
                && top == that.top
                && width == that.width
                && Objects.equals(itemData, that.itemData)
                && Objects.equals(list, that.list);
    }

    @Override public int hashCode() {
        return Objects.hash(appearance, backColor, causesValidation, dataField, dataFormat, dataMember,
                dataSource, dragIcon, dragMode, enabled, foreColor, helpContextId, integralHeight, locked,
                mouseIcon, mousePointer, oleDragMode, oleDropMode, rightToLeft, sorted, style, tabIndex,
                tabStop, text, toolTipText, visible, whatsThisHelpId, height, left, top, width, itemData,
                list);
    }

    /** Mutable staging copy; starts at the IDE defaults and is frozen by {@link #build()}. */
    public static final class Builder {
        public Appearance appearance = Appearance.THREE_D;
        public Color backColor = Color.WINDOW_BACKGROUND;
        public CausesValidation causesValidation = CausesValidation.YES;
        public String dataField = "";
        public String dataFormat = "";
        public String dataMember = "";
        public String dataSource = "";
        public PropertyValue dragIcon;
        public DragMode dragMode = DragMode.MANUAL;
        public Activation enabled = Activation.ENABLED;
        public Color foreColor = Color.WINDOW_TEXT;
        public int helpContextId = 0;
        public boolean integralHeight = true;
        public boolean locked = false;
        public PropertyValue mouseIcon;
        public MousePointer mousePointer = MousePointer.DEFAULT;
        public OleDragMode oleDragMode = OleDragMode.MANUAL;
        public OleDropMode oleDropMode = OleDropMode.NONE;
        public TextDirection rightToLeft = TextDirection.LEFT_TO_RIGHT;
        public boolean sorted = false;
        public ComboBoxStyle style = ComboBoxStyle.DROP_DOWN_COMBO;
        public int tabIndex = 0;
        public TabStop tabStop = TabStop.INCLUDED;
        public String text = "";
        public String toolTipText = "";
        public Visibility visible = Visibility.VISIBLE;
        public int whatsThisHelpId = 0;
        public int height = 30;
        public int left = 30;
        public int top = 30;
        public int width = 100;
        public List<String> itemData = List.of();
        public List<String> list = List.of();

        public ComboBoxProperties build() {
            return new ComboBoxProperties(this);
        }
    }
}
