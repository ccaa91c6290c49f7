package info.isaksson.erland.vbform.model.controls;

import com.fasterxml.jackson.annotation.JsonInclude;
import info.isaksson.erland.vbform.model.Color;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.props.Activation;
import info.isaksson.erland.vbform.model.props.Appearance;
import info.isaksson.erland.vbform.model.props.ButtonStyle;
import info.isaksson.erland.vbform.model.props.CausesValidation;
import info.isaksson.erland.vbform.model.props.CheckBoxValue;
import info.isaksson.erland.vbform.model.props.DragMode;
import info.isaksson.erland.vbform.model.props.JustifyAlignment;
import info.isaksson.erland.vbform.model.props.MousePointer;
import info.isaksson.erland.vbform.model.props.OleDropMode;
import info.isaksson.erland.vbform.model.props.TabStop;
import info.isaksson.erland.vbform.model.props.TextDirection;
import info.isaksson.erland.vbform.model.props.UseMaskColor;
import info.isaksson.erland.vbform.model.props.Visibility;

import java.util.Objects;

/** A check box. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CheckBoxProperties {
    public final JustifyAlignment alignment;
    public final Appearance appearance;
    public final Color backColor;
    public final String caption;
    public final CausesValidation causesValidation;
    public final String dataField;
    public final String dataFormat;
    public final String dataMember;
    public final String dataSource;
    public final PropertyValue disabledPicture;
    public final PropertyValue downPicture;
    public final PropertyValue dragIcon;
    public final DragMode dragMode;
    public final Activation enabled;
    public final Color foreColor;
    public final int height;
    public final int helpContextId;
    public final int left;
    public final Color maskColor;
    public final PropertyValue mouseIcon;
    public final MousePointer mousePointer;
    public final OleDropMode oleDropMode;
    public final PropertyValue picture;
    public final TextDirection rightToLeft;
    public final ButtonStyle style;
    public final int tabIndex;
    public final TabStop tabStop;
    public final String toolTipText;
    public final int top;
    public final UseMaskColor useMaskColor;
    public final CheckBoxValue value;
    public final Visibility visible;
    public final int whatsThisHelpId;
    public final int width;

    /** All properties at their IDE defaults. */
    public CheckBoxProperties() {
        this(new Builder());
    }

    private CheckBoxProperties(Builder b) {
        this.alignment = b.alignment;
        this.appearance = b.appearance;
        this.backColor = b.backColor;
        this.caption = b.caption;
        this.causesValidation = b.causesValidation;
        this.dataField = b.dataField;
        this.dataFormat = b.dataFormat;
        this.dataMember = b.dataMember;
        this.dataSource = b.dataSource;
        this.disabledPicture = b.disabledPicture;
        this.downPicture = b.downPicture;
        this.dragIcon = b.dragIcon;
        this.dragMode = b.dragMode;
        this.enabled = b.enabled;
        this.foreColor = b.foreColor;
        this.height = b.height;
        this.helpContextId = b.helpContextId;
        this.left = b.left;
        this.maskColor = b.maskColor;
        this.mouseIcon = b.mouseIcon;
        this.mousePointer = b.mousePointer;
        this.oleDropMode = b.oleDropMode;
        this.picture = b.picture;
        this.rightToLeft = b.rightToLeft;
        this.style = b.style;
        this.tabIndex = b.tabIndex;
        this.tabStop = b.tabStop;
        this.toolTipText = b.toolTipText;
        this.top = b.top;
        this.useMaskColor = b.useMaskColor;
        this.value = b.value;
        this.visible = b.visible;
        this.whatsThisHelpId = b.whatsThisHelpId;
        this.width = b.width;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CheckBoxProperties)) return false;
        CheckBoxProperties that = (CheckBoxProperties) o;
        return Objects.equals(alignment, that.alignment)
                && Objects.equals(appearance, that.appearance)
                && Objects.equals(backColor, that.backColor)
                && Objects.equals(caption, that.caption)
                && Objects.equals(causesValidation, that.causesValidation)
                && Objects.equals(dataField, that.dataField)
                && Objects.equals(dataFormat, that.dataFormat)
                && Objects.equals(dataMember, that.dataMember)
                && Objects.equals(dataSource, that.dataSource)
                && Objects.equals(disabledPicture, that.disabledPicture)
                && Objects.equals(downPicture, that.downPicture)
                && Objects.equals(dragIcon, that.dragIcon)
                && Objects.equals(dragMode, that.dragMode)
                && Objects.equals(enabled, that.enabled)
                && Objects.equals(foreColor, that.foreColor)
                && height == that.height
                && helpContextId == that.helpContextId
                && left == that.left
                && Objects.equals(maskColor, that.maskColor)
                && Objects.equals(mouseIcon, that.mouseIcon)
                && Objects.equals(mousePointer, that.mousePointer)
                && Objects.equals(oleDropMode, that.oleDropMode)
                && Objects.equals(picture, that.picture)
                && Objects.equals(rightToLeft, that.rightToLeft)
                && Objects.equals(style, that.style)
                && tabIndex == that.tabIndex
                && Objects.equals(tabStop, that.tabStop)
                && Objects.equals(toolTipText, that.toolTipText)
                && top == that.top
                && Objects.equals(useMaskColor, that.useMaskColor)
                && Objects.equals(value, that.value)
                && Objects.equals(visible, that.visible)
                && whatsThisHelpId == that.whatsThisHelpId
                && width == that.width;
    }

    @Override public int hashCode() {
        return Objects.hash(alignment, appearance, backColor, caption, causesValidation, dataField,
                dataFormat, dataMember, dataSource, disabledPicture, downPicture, dragIcon, dragMode,
                enabled, foreColor, height, helpContextId, left, maskColor, mouseIcon, mousePointer,
                oleDropMode, picture, rightToLeft, style, tabIndex, tabStop, toolTipText, top, useMaskColor,
                value, visible, whatsThisHelpId, width);
    }

    /** Mutable staging copy; starts at the IDE defaults and is frozen by {@link #build()}. */
    public static final class Builder {
        public JustifyAlignment alignment = JustifyAlignment.LEFT_JUSTIFY;
        public Appearance appearance = Appearance.THREE_D;
        public Color backColor = Color.BUTTON_FACE;
        public String caption = "";
        public CausesValidation causesValidation = CausesValidation.YES;
        public String dataField = "";
        public String dataFormat = "";
        public String dataMember = "";
        public String dataSource = "";
        public PropertyValue disabledPicture;
        public PropertyValue downPicture;
        public PropertyValue dragIcon;
        public DragMode dragMode = DragMode.MANUAL;
        public Activation enabled = Activation.ENABLED;
        public Color foreColor = Color.BUTTON_TEXT;
        public int height = 30;
        public int helpContextId = 0;
        public int left = 30;
        public Color maskColor = Color.SILVER;
        public PropertyValue mouseIcon;
        public MousePointer mousePointer = MousePointer.DEFAULT;
        public OleDropMode oleDropMode = OleDropMode.NONE;
        public PropertyValue picture;
        public TextDirection rightToLeft = TextDirection.LEFT_TO_RIGHT;
        public ButtonStyle style = ButtonStyle.STANDARD;
        public int tabIndex = 0;
        public TabStop tabStop = TabStop.INCLUDED;
        public String toolTipText = "";
        public int top = 30;
        public UseMaskColor useMaskColor = UseMaskColor.DO_NOT_USE_MASK_COLOR;
        public CheckBoxValue value = CheckBoxValue.UNCHECKED;
        public Visibility visible = Visibility.VISIBLE;
        public int whatsThisHelpId = 0;
        public int width = 100;

        public CheckBoxProperties build() {
            return new CheckBoxProperties(this);
        }
    }
}
