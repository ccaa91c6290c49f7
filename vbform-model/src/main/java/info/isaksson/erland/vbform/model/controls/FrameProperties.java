package info.isaksson.erland.vbform.model.controls;

import com.fasterxml.jackson.annotation.JsonInclude;
import info.isaksson.erland.vbform.model.Color;
import info.isaksson.erland.vbform.model.PropertyValue;
import info.isaksson.erland.vbform.model.props.Activation;
import info.isaksson.erland.vbform.model.props.Appearance;
import info.isaksson.erland.vbform.model.props.BorderStyle;
import info.isaksson.erland.vbform.model.props.ClipControls;
import info.isaksson.erland.vbform.model.props.DragMode;
import info.isaksson.erland.vbform.model.props.MousePointer;
import info.isaksson.erland.vbform.model.props.OleDropMode;
import info.isaksson.erland.vbform.model.props.TextDirection;
import info.isaksson.erland.vbform.model.props.Visibility;

import java.util.Objects;

/** Frame properties. Child controls are held by {@link info.isaksson.erland.vbform.model.ControlKind.Frame}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FrameProperties {
    public final Appearance appearance;
    public final Color backColor;
    public final BorderStyle borderStyle;
    public final String caption;
    public final ClipControls clipControls;
    public final PropertyValue dragIcon;
    public final DragMode dragMode;
    public final Activation enabled;
    public final Color foreColor;
    public final int helpContextId;
    public final PropertyValue mouseIcon;
    public final MousePointer mousePointer;
    public final OleDropMode oleDropMode;
    public final TextDirection rightToLeft;
    public final int tabIndex;
    public final String toolTipText;
    public final Visibility visible;
    public final int whatsThisHelpId;
    public final int height;
    public final int left;
    public final int top;
    public final int width;

    /** All properties at their IDE defaults. */
    public FrameProperties() {
        this(new Builder());
    }

    private FrameProperties(Builder b) {
        this.appearance = b.appearance;
        this.backColor = b.backColor;
        this.borderStyle = b.borderStyle;
        this.caption = b.caption;
        this.clipControls = b.clipControls;
        this.dragIcon = b.dragIcon;
        this.dragMode = b.dragMode;
        this.enabled = b.enabled;
        this.foreColor = b.foreColor;
        this.helpContextId = b.helpContextId;
        this.mouseIcon = b.mouseIcon;
        this.mousePointer = b.mousePointer;
        this.oleDropMode = b.oleDropMode;
        this.rightToLeft = b.rightToLeft;
        this.tabIndex = b.tabIndex;
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
        if (!(o instanceof FrameProperties)) return false;
        FrameProperties that = (FrameProperties) o;
        return Objects.equals(appearance, that.appearance)
                && Objects.equals(backColor, that.backColor)
                && Objects.equals(borderStyle, that.borderStyle)
                && Objects.equals(caption, that.caption)
                && Objects.equals(clipControls, that.clipControls)
                && Objects.equals(dragIcon, that.dragIcon)
                && Objects.equals(dragMode, that.dragMode)
                && Objects.equals(enabled, that.enabled)
                && Objects.equals(foreColor, that.foreColor)
                && helpContextId == that.helpContextId
                && Objects.equals(mouseIcon, that.mouseIcon)
                && Objects.equals(mousePointer, that.mousePointer)
                && Objects.equals(oleDropMode, that.oleDropMode)
                && Objects.equals(rightToLeft, that.rightToLeft)
                && tabIndex == that.tabIndex
                && Objects.equals(toolTipText, that.toolTipText)
                && Objects.equals(visible, that.visible)
                && whatsThisHelpId == that.whatsThisHelpId
                && height == that.height
                && left == that.left
                && top == that.top
                && width == that.width;
    }

    @Override public int hashCode() {
        return Objects.hash(appearance, backColor, borderStyle, caption, clipControls, dragIcon, dragMode,
                enabled, foreColor, helpContextId, mouseIcon, mousePointer, oleDropMode, rightToLeft,
                tabIndex, toolTipText, visible, whatsThisHelpId, height, left, top, width);
    }

    /** Mutable staging copy; starts at the IDE defaults and is frozen by {@link #build()}. */
    public static final class Builder {
        public Appearance appearance = Appearance.THREE_D;
        public Color backColor = Color.BUTTON_FACE;
        public BorderStyle borderStyle = BorderStyle.FIXED_SINGLE;
        public String caption = "Frame1";
        public ClipControls clipControls = ClipControls.CLIPPED;
        public PropertyValue dragIcon;
        public DragMode dragMode = DragMode.MANUAL;
        public Activation enabled = Activation.ENABLED;
        public Color foreColor = Color.BUTTON_TEXT;
        public int helpContextId = 0;
        public PropertyValue mouseIcon;
        public MousePointer mousePointer = MousePointer.DEFAULT;
        public OleDropMode oleDropMode = OleDropMode.NONE;
        public TextDirection rightToLeft = TextDirection.LEFT_TO_RIGHT;
        public int tabIndex = 0;
        public String toolTipText = "";
        public Visibility visible = Visibility.VISIBLE;
        public int whatsThisHelpId = 0;
        public int height = 30;
        public int left = 30;
        public int top = 30;
        public int width = 100;

        public FrameProperties build() {
            return new FrameProperties(this);
        }
    }
}
