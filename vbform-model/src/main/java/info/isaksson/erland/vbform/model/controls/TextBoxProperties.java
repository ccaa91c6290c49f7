package info.isaksson.erland.vbform.model.controls;

import com.fasterxml.jackson.annotation.JsonInclude;
import info.isaksson.erland.vbform.model.Color;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.props.Activation;
import info.isaksson.erland.vbform.model.props.Alignment;
import info.isaksson.erland.vbform.model.props.Appearance;
import info.isaksson.erland.vbform.model.props.BorderStyle;
import info.isaksson.erland.vbform.model.props.CausesValidation;
import info.isaksson.erland.vbform.model.props.DragMode;
import info.isaksson.erland.vbform.model.props.LinkMode;
import info.isaksson.erland.vbform.model.props.MousePointer;
import info.isaksson.erland.vbform.model.props.MultiLine;
import info.isaksson.erland.vbform.model.props.OleDragMode;
import info.isaksson.erland.vbform.model.props.OleDropMode;
import info.isaksson.erland.vbform.model.props.ScrollBars;
import info.isaksson.erland.vbform.model.props.TabStop;
import info.isaksson.erland.vbform.model.props.TextDirection;
import info.isaksson.erland.vbform.model.props.Visibility;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TextBoxProperties {
    public final Alignment alignment;
    public final Appearance appearance;
    public final Color backColor;
    public final BorderStyle borderStyle;
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
    public final boolean hideSelection;
    public final String linkItem;
    public final LinkMode linkMode;
    public final int linkTimeout;
    public final String linkTopic;
    public final boolean locked;
    public final int maxLength;
    public final PropertyValue mouseIcon;
    public final MousePointer mousePointer;
    public final MultiLine multiLine;
    public final OleDragMode oleDragMode;
    public final OleDropMode oleDropMode;
    /** First character of {@code PasswordChar}; {@code null} when not set. */
    public final String passwordChar;
    public final TextDirection rightToLeft;
    public final ScrollBars scrollBars;
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

    /** All properties at their IDE defaults. */
    public TextBoxProperties() {
        this(new Builder());
    }

    private TextBoxProperties(Builder b) {
        this.alignment = b.alignment;
        this.appearance = b.appearance;
        this.backColor = b.backColor;
        this.borderStyle = b.borderStyle;
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
        this.hideSelection = b.hideSelection;
        this.linkItem = b.linkItem;
        this.linkMode = b.linkMode;
        this.linkTimeout = b.linkTimeout;
        this.linkTopic = b.linkTopic;
        this.locked = b.locked;
        this.maxLength = b.maxLength;
        this.mouseIcon = b.mouseIcon;
        this.mousePointer = b.mousePointer;
        this.multiLine = b.multiLine;
        this.oleDragMode = b.oleDragMode;
        this.oleDropMode = b.oleDropMode;
        this.passwordChar = b.passwordChar;
        this.rightToLeft = b.rightToLeft;
        this.scrollBars = b.scrollBars;
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
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextBoxProperties)) return false;
        TextBoxProperties that = (TextBoxProperties) o;
        return Objects.equals(alignment, that.alignment)
                && Objects.equals(appearance, that.appearance)
                && Objects.equals(backColor, that.backColor)
                && Objects.equals(borderStyle, that.borderStyle)
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
                && hideSelection == that.hideSelection
                && Objects.equals(linkItem, that.linkItem)
                && Objects.equals(linkMode, that.linkMode)
                && linkTimeout == that.linkTimeout
                && Objects.equals(linkTopic, that.linkTopic)
                && locked == that.locked
                && maxLength == that.maxLength
                && Objects.equals(mouseIcon, that.mouseIcon)
                && Objects.equals(mousePointer, that.mousePointer)
                && Objects.equals(multiLine, that.multiLine)
                && Objects.equals(oleDragMode, that.oleDragMode)
                && Objects.equals(oleDropMode, that.oleDropMode)
                && Objects.equals(passwordChar, that.passwordChar)
                && Objects.equals(rightToLeft, that.rightToLeft)
                && Objects.equals(scrollBars, that.scrollBars)
                && tabIndex == that.tabIndex
                && Objects.equals(tabStop, that.tabStop)
                && Objects.equals(text, that.text)
                && Objects.equals(toolTipText, that.toolTipText)
                && Objects.equals(visible, that.visible)
                && whatsThisHelpId == that.whatsThisHelpId
                && height == that.height
                && left == that.left
                && top == that.top
                && width == that.width;
    }

    @Override public int hashCode() {
        return Objects.hash(alignment, appearance, backColor, borderStyle, causesValidation, dataField,
                dataFormat, dataMember, dataSource, dragIcon, dragMode, enabled, foreColor, helpContextId,
                hideSelection, linkItem, linkMode, linkTimeout, linkTopic, locked, maxLength, mouseIcon,
                mousePointer, multiLine, oleDragMode, oleDropMode, passwordChar, rightToLeft, scrollBars,
                tabIndex, tabStop, text, toolTipText, visible, whatsThisHelpId, height, left, top, width);
    }

    /** Mutable staging copy; starts at the IDE defaults and is frozen by {@link #build()}. */
    public static final class Builder {
        public Alignment alignment = Alignment.LEFT_JUSTIFY;
        public Appearance appearance = Appearance.THREE_D;
        public Color backColor = Color.WINDOW_BACKGROUND;
        public BorderStyle borderStyle = BorderStyle.FIXED_SINGLE;
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
        public boolean hideSelection = true;
        public String linkItem = "";
        public LinkMode linkMode = LinkMode.NONE;
        public int linkTimeout = 50;
        public String linkTopic = "";
        public boolean locked = false;
        public int maxLength = 0;
        public PropertyValue mouseIcon;
        public MousePointer mousePointer = MousePointer.DEFAULT;
        public MultiLine multiLine = MultiLine.SINGLE_LINE;
        public OleDragMode oleDragMode = OleDragMode.MANUAL;
        public OleDropMode oleDropMode = OleDropMode.NONE;
        public String passwordChar = null;
        public TextDirection rightToLeft = TextDirection.LEFT_TO_RIGHT;
        public ScrollBars scrollBars = ScrollBars.NONE;
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

        public TextBoxProperties build() {
            return new TextBoxProperties(this);
        }
    }
}
