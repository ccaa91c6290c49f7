package info.isaksson.erland.vbform.model.controls;

import com.fasterxml.jackson.annotation.JsonInclude;
import info.isaksson.erland.vbform.model.Color;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.props.Activation;
import info.isaksson.erland.vbform.model.props.Alignment;
import info.isaksson.erland.vbform.model.props.Appearance;
import info.isaksson.erland.vbform.model.props.AutoSize;
import info.isaksson.erland.vbform.model.props.BackStyle;
import info.isaksson.erland.vbform.model.props.BorderStyle;
import info.isaksson.erland.vbform.model.props.DragMode;
import info.isaksson.erland.vbform.model.props.LinkMode;
import info.isaksson.erland.vbform.model.props.MousePointer;
import info.isaksson.erland.vbform.model.props.OleDropMode;
import info.isaksson.erland.vbform.model.props.TextDirection;
import info.isaksson.erland.vbform.model.props.Visibility;
import info.isaksson.erland.vbform.model.props.WordWrap;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class LabelProperties {
    public final Alignment alignment;
    public final Appearance appearance;
    public final AutoSize autoSize;
    public final Color backColor;
    public final BackStyle backStyle;
    public final BorderStyle borderStyle;
    public final String caption;
    public final String dataField;
    public final String dataFormat;
    public final String dataMember;
    public final String dataSource;
    public final PropertyValue dragIcon;
    public final DragMode dragMode;
    public final Activation enabled;
    public final Color foreColor;
    public final String linkItem;
    public final LinkMode linkMode;
    public final int linkTimeout;
    public final String linkTopic;
    public final PropertyValue mouseIcon;
    public final MousePointer mousePointer;
    public final OleDropMode oleDropMode;
    public final TextDirection rightToLeft;
    public final int tabIndex;
    public final String toolTipText;
    public final boolean useMnemonic;
    public final Visibility visible;
    public final int whatsThisHelpId;
    public final WordWrap wordWrap;
    public final int height;
    public final int left;
    public final int top;
    public final int width;

    /** All properties at their IDE defaults. */
    public LabelProperties() {
        this(new Builder());
    }

    private LabelProperties(Builder b) {
        this.alignment = b.alignment;
        this.appearance = b.appearance;
        this.autoSize = b.autoSize;
        this.backColor = b.backColor;
        this.backStyle = b.backStyle;
        this.borderStyle = b.borderStyle;
        this.caption = b.caption;
        this.dataField = b.dataField;
        this.dataFormat = b.dataFormat;
        this.dataMember = b.dataMember;
        this.dataSource = b.dataSource;
        this.dragIcon = b.dragIcon;
        this.dragMode = b.dragMode;
        this.enabled = b.enabled;
        this.foreColor = b.foreColor;
        this.linkItem = b.linkItem;
        this.linkMode = b.linkMode;
        this.linkTimeout = b.linkTimeout;
        this.linkTopic = b.linkTopic;
        this.mouseIcon = b.mouseIcon;
        this.mousePointer = b.mousePointer;
        this.oleDropMode = b.oleDropMode;
        this.rightToLeft = b.rightToLeft;
        this.tabIndex = b.tabIndex;
        this.toolTipText = b.toolTipText;
        this.useMnemonic = b.useMnemonic;
        this.visible = b.visible;
        this.whatsThisHelpId = b.whatsThisHelpId;
        this.wordWrap = b.wordWrap;
        this.height = b.height;
        this.left = b.left;
        this.top = b.top;
        this.width = b.width;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LabelProperties)) return false;
        LabelProperties that = (LabelProperties) o;
        return Objects.equals(alignment, that.alignment)
                && Objects.equals(appearance, that.appearance)
                && Objects.equals(autoSize, that.autoSize)
                && Objects.equals(backColor, that.backColor)
                && Objects.equals(backStyle, that.backStyle)
                && Objects.equals(borderStyle, that.borderStyle)
                && Objects.equals(caption, that.caption)
                && Objects.equals(dataField, that.dataField)
                && Objects.equals(dataFormat, that.dataFormat)
                && Objects.equals(dataMember, that.dataMember)
                && Objects.equals(dataSource, that.dataSource)
                && Objects.equals(dragIcon, that.dragIcon)
                && Objects.equals(dragMode, that.dragMode)
                && Objects.equals(enabled, that.enabled)
                && Objects.equals(foreColor, that.foreColor)
                && Objects.equals(linkItem, that.linkItem)
                && Objects.equals(linkMode, that.linkMode)
                && linkTimeout == that.linkTimeout
                && Objects.equals(linkTopic, that.linkTopic)
                && Objects.equals(mouseIcon, that.mouseIcon)
                && Objects.equals(mousePointer, that.mousePointer)
                && Objects.equals(oleDropMode, that.oleDropMode)
                && Objects.equals(rightToLeft, that.rightToLeft)
                && tabIndex == that.tabIndex
                && Objects.equals(toolTipText, that.toolTipText)
                && useMnemonic == that.useMnemonic
                && Objects.equals(visible, that.visible)
                && whatsThisHelpId == that.whatsThisHelpId
                && Objects.equals(wordWrap, that.wordWrap)
                && height == that.height
                && left == that.left
                && top == that.top
                && width == that.width;
    }

    @Override public int hashCode() {
        return Objects.hash(alignment, appearance, autoSize, backColor, backStyle, borderStyle, caption,
                dataField, dataFormat, dataMember, dataSource, dragIcon, dragMode, enabled, foreColor,
                linkItem, linkMode, linkTimeout, linkTopic, mouseIcon, mousePointer, oleDropMode,
                rightToLeft, tabIndex, toolTipText, useMnemonic, visible, whatsThisHelpId, wordWrap, height,
                left, top, width);
    }

    /** Mutable staging copy; starts at the IDE defaults and is frozen by {@link #build()}. */
    public static final class Builder {
        public Alignment alignment = Alignment.LEFT_JUSTIFY;
        public Appearance appearance = Appearance.THREE_D;
        public AutoSize autoSize = AutoSize.FIXED;
        public Color backColor = Color.BUTTON_FACE;
        public BackStyle backStyle = BackStyle.OPAQUE;
        public BorderStyle borderStyle = BorderStyle.NONE;
        public String caption = "";
        public String dataField = "";
        public String dataFormat = "";
        public String dataMember = "";
        public String dataSource = "";
        public PropertyValue dragIcon;
        public DragMode dragMode = DragMode.MANUAL;
        public Activation enabled = Activation.ENABLED;
        public Color foreColor = Color.BUTTON_TEXT;
        public String linkItem = "";
        public LinkMode linkMode = LinkMode.NONE;
        public int linkTimeout = 50;
        public String linkTopic = "";
        public PropertyValue mouseIcon;
        public MousePointer mousePointer = MousePointer.DEFAULT;
        public OleDropMode oleDropMode = OleDropMode.NONE;
        public TextDirection rightToLeft = TextDirection.LEFT_TO_RIGHT;
        public int tabIndex = 0;
        public String toolTipText = "";
        public boolean useMnemonic = true;
        public Visibility visible = Visibility.VISIBLE;
        public int whatsThisHelpId = 0;
        public WordWrap wordWrap = WordWrap.NON_WRAPPING;
        public int height = 30;
        public int left = 30;
        public int top = 30;
        public int width = 100;

        public LabelProperties build() {
            return new LabelProperties(this);
        }
    }
}
